package com.vibecoding.autoscaler.util;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Quantity;

/**
 * 노드 GPU 보유 여부 판단
 */
public final class GpuUtils {

    private GpuUtils() {
    }

    /**
     * GPU 라벨이 있거나, 할당 가능한 nvidia.com/gpu 가 0보다 크면 GPU 노드로 본다.
     * 드라이버 설치 전(GPU 미준비) 노드도 라벨만으로 GPU 노드로 분류된다.
     */
    public static boolean nodeHasGpu(String gpuLabel, Node node) {
        if (gpuLabel != null && NodeLabels.labelsOf(node).containsKey(gpuLabel)) {
            return true;
        }
        if (node == null || node.getStatus() == null || node.getStatus().getAllocatable() == null) {
            return false;
        }
        Quantity allocatable = node.getStatus().getAllocatable().get(ResourceNames.NVIDIA_GPU);
        return allocatable != null && Quantities.milliValue(allocatable) != 0;
    }
}
