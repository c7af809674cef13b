package com.vibecoding.autoscaler.utilization;

import com.vibecoding.autoscaler.config.UtilizationProperties;
import com.vibecoding.autoscaler.exception.ResourceUtilizationException;
import com.vibecoding.autoscaler.model.NodeInfo;
import com.vibecoding.autoscaler.model.UtilizationInfo;
import com.vibecoding.autoscaler.util.GpuUtils;
import com.vibecoding.autoscaler.util.PodUtils;
import com.vibecoding.autoscaler.util.Quantities;
import com.vibecoding.autoscaler.util.ResourceNames;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * 노드 사용률 계산기
 *
 * 리소스별 사용률 = Pod 요청량 합 / allocatable.
 * GPU 노드는 GPU 사용률만, 그 외 노드는 max(CPU, 메모리) 사용률을 노드 사용률로 본다.
 */
@Service
@RequiredArgsConstructor
public class UtilizationCalculator {

    private static final Logger log = LoggerFactory.getLogger(UtilizationCalculator.class);

    private final UtilizationProperties properties;

    /**
     * 설정된 기본값(skip 플래그, GPU 라벨)으로 사용률 계산
     */
    public UtilizationInfo calculate(NodeInfo nodeInfo, Instant now) {
        return calculate(nodeInfo, properties.isSkipDaemonSetPods(), properties.isSkipMirrorPods(),
                properties.getGpuLabel(), now);
    }

    public UtilizationInfo calculate(NodeInfo nodeInfo, boolean skipDaemonSetPods, boolean skipMirrorPods,
                                     String gpuLabel, Instant now) {
        if (GpuUtils.nodeHasGpu(gpuLabel, nodeInfo.getNode())) {
            double gpuUtil;
            try {
                gpuUtil = calculateUtilizationOfResource(nodeInfo, ResourceNames.NVIDIA_GPU,
                        skipDaemonSetPods, skipMirrorPods, now);
            } catch (ResourceUtilizationException e) {
                // GPU 미준비 노드도 축소 대상으로 검토할 수 있도록 0 으로 처리
                log.debug("node {} has unready GPU: {}", nodeInfo.getNodeName(), e.getMessage());
                return UtilizationInfo.builder()
                        .gpuUtil(0)
                        .resourceName(ResourceNames.NVIDIA_GPU)
                        .utilization(0)
                        .build();
            }

            // GPU 노드는 CPU/메모리 사용률을 계산하지 않음
            return UtilizationInfo.builder()
                    .gpuUtil(gpuUtil)
                    .resourceName(ResourceNames.NVIDIA_GPU)
                    .utilization(gpuUtil)
                    .build();
        }

        double cpu = calculateUtilizationOfResource(nodeInfo, ResourceNames.CPU, skipDaemonSetPods, skipMirrorPods, now);
        double mem = calculateUtilizationOfResource(nodeInfo, ResourceNames.MEMORY, skipDaemonSetPods, skipMirrorPods, now);

        UtilizationInfo.UtilizationInfoBuilder utilization = UtilizationInfo.builder()
                .cpuUtil(cpu)
                .memUtil(mem);
        if (cpu > mem) {
            utilization.resourceName(ResourceNames.CPU).utilization(cpu);
        } else {
            utilization.resourceName(ResourceNames.MEMORY).utilization(mem);
        }
        return utilization.build();
    }

    /**
     * 단일 리소스 사용률. 요청량은 milli 단위 정수로 누적한 뒤 마지막에만 나눈다.
     */
    double calculateUtilizationOfResource(NodeInfo nodeInfo, String resourceName,
                                          boolean skipDaemonSetPods, boolean skipMirrorPods, Instant now) {
        String nodeName = nodeInfo.getNodeName();
        Quantity nodeAllocatable = allocatableOf(nodeInfo.getNode()).get(resourceName);
        if (nodeAllocatable == null) {
            throw ResourceUtilizationException.missing(nodeName, resourceName);
        }
        long allocatableMilli = Quantities.milliValue(nodeAllocatable);
        if (allocatableMilli == 0) {
            throw ResourceUtilizationException.zero(nodeName, resourceName);
        }

        long podsRequestMilli = 0;
        // skip 플래그가 켜진 경우 DaemonSet/미러 Pod 요청량은 allocatable 에서 차감
        long daemonSetAndMirrorPodsMilli = 0;

        for (Pod pod : nodeInfo.getPods()) {
            PodAccounting accounting = PodAccounting.classify(pod, skipDaemonSetPods, skipMirrorPods, now);
            switch (accounting) {
                case RESERVED:
                    daemonSetAndMirrorPodsMilli += requestMilli(pod, resourceName);
                    break;
                case COUNTED:
                    podsRequestMilli += requestMilli(pod, resourceName);
                    break;
                case IGNORED:
                    log.trace("Ignoring long terminating pod {} on node {}", PodUtils.nameOf(pod), nodeName);
                    break;
            }
        }

        long effectiveAllocatable = allocatableMilli - daemonSetAndMirrorPodsMilli;
        if (effectiveAllocatable <= 0) {
            throw ResourceUtilizationException.noCapacityLeft(nodeName, resourceName,
                    allocatableMilli, daemonSetAndMirrorPodsMilli);
        }
        return (double) podsRequestMilli / effectiveAllocatable;
    }

    private static long requestMilli(Pod pod, String resourceName) {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return 0L;
        }
        long total = 0L;
        for (Container container : pod.getSpec().getContainers()) {
            if (container.getResources() != null) {
                total += Quantities.milliValue(container.getResources().getRequests(), resourceName);
            }
        }
        return total;
    }

    private static Map<String, Quantity> allocatableOf(Node node) {
        if (node == null || node.getStatus() == null || node.getStatus().getAllocatable() == null) {
            return Map.of();
        }
        return node.getStatus().getAllocatable();
    }
}
