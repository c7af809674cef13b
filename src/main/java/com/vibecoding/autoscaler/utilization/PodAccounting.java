package com.vibecoding.autoscaler.utilization;

import com.vibecoding.autoscaler.util.PodUtils;
import io.fabric8.kubernetes.api.model.Pod;

import java.time.Instant;

/**
 * 사용률 계산 시 Pod 요청량을 어디에 반영할지
 */
public enum PodAccounting {
    /** 분자(사용량)에 합산 */
    COUNTED,
    /** 분자에서 제외하고 allocatable 에서 차감 (DaemonSet, 미러 Pod) */
    RESERVED,
    /** 분자/분모 모두 제외 (오래 종료 중인 Pod) */
    IGNORED;

    /**
     * Pod 당 한 번 평가. 판정 순서: DaemonSet → 미러 → 장기 종료 → 일반
     */
    public static PodAccounting classify(Pod pod, boolean skipDaemonSetPods, boolean skipMirrorPods, Instant now) {
        if (skipDaemonSetPods && PodUtils.isDaemonSetPod(pod)) {
            return RESERVED;
        }
        if (skipMirrorPods && PodUtils.isMirrorPod(pod)) {
            return RESERVED;
        }
        if (PodUtils.isLongTerminating(pod, now)) {
            return IGNORED;
        }
        return COUNTED;
    }
}
