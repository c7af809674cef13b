package com.vibecoding.autoscaler.util;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Pod 메타데이터 기반 분류 유틸
 */
public final class PodUtils {

    public static final String DAEMON_SET_POD_ANNOTATION = "cluster-autoscaler.kubernetes.io/daemonset-pod";
    public static final String MIRROR_POD_ANNOTATION = "kubernetes.io/config.mirror";

    // spec.terminationGracePeriodSeconds 미지정 시 쿠버네티스 기본값
    static final long DEFAULT_TERMINATION_GRACE_PERIOD_SECONDS = 30L;

    // 유예 기간 이후 이 시간이 더 지나야 "오래 종료 중"으로 판단
    static final Duration LONG_TERMINATING_EXTRA_THRESHOLD = Duration.ofSeconds(30);

    private PodUtils() {
    }

    /**
     * DaemonSet 컨트롤러 소유 Pod 이거나, daemonset-pod 어노테이션이 "true" 인 Pod
     */
    public static boolean isDaemonSetPod(Pod pod) {
        ObjectMeta metadata = pod.getMetadata();
        if (metadata == null) {
            return false;
        }
        if (metadata.getOwnerReferences() != null) {
            for (OwnerReference owner : metadata.getOwnerReferences()) {
                if (Boolean.TRUE.equals(owner.getController()) && "DaemonSet".equals(owner.getKind())) {
                    return true;
                }
            }
        }
        Map<String, String> annotations = metadata.getAnnotations();
        return annotations != null && "true".equals(annotations.get(DAEMON_SET_POD_ANNOTATION));
    }

    /**
     * kubelet 이 정적 Pod 에 대해 API 서버에 만든 미러 Pod
     */
    public static boolean isMirrorPod(Pod pod) {
        ObjectMeta metadata = pod.getMetadata();
        return metadata != null
                && metadata.getAnnotations() != null
                && metadata.getAnnotations().containsKey(MIRROR_POD_ANNOTATION);
    }

    /**
     * 삭제 요청 후 유예 기간 + 추가 임계 시간이 지나도 남아있는 Pod
     */
    public static boolean isLongTerminating(Pod pod, Instant now) {
        ObjectMeta metadata = pod.getMetadata();
        if (metadata == null || metadata.getDeletionTimestamp() == null) {
            return false;
        }

        Instant deletionTime = Instant.parse(metadata.getDeletionTimestamp());

        long gracePeriodSeconds = DEFAULT_TERMINATION_GRACE_PERIOD_SECONDS;
        if (pod.getSpec() != null && pod.getSpec().getTerminationGracePeriodSeconds() != null) {
            gracePeriodSeconds = pod.getSpec().getTerminationGracePeriodSeconds();
        }

        return deletionTime
                .plusSeconds(gracePeriodSeconds)
                .plus(LONG_TERMINATING_EXTRA_THRESHOLD)
                .isBefore(now);
    }

    public static String nameOf(Pod pod) {
        if (pod.getMetadata() == null) {
            return "<unnamed>";
        }
        return pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
    }
}
