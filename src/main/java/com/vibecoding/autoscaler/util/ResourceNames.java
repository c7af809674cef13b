package com.vibecoding.autoscaler.util;

/**
 * 노드/컨테이너 리소스 이름
 */
public final class ResourceNames {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";

    // GPU 탐지 유틸과 가격 모델이 공통으로 사용하는 확장 리소스 이름
    public static final String NVIDIA_GPU = "nvidia.com/gpu";

    private ResourceNames() {
    }
}
