package com.vibecoding.autoscaler.util;

import io.fabric8.kubernetes.api.model.Node;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 가격 산정에 사용하는 노드 라벨 키와 조회 헬퍼
 */
public final class NodeLabels {

    public static final String INSTANCE_TYPE_STABLE = "node.kubernetes.io/instance-type";
    public static final String INSTANCE_TYPE_LEGACY = "beta.kubernetes.io/instance-type";

    public static final String PREEMPTIBLE = "cloud.google.com/gke-preemptible";
    public static final String SPOT = "cloud.google.com/gke-spot";

    public static final String GKE_ACCELERATOR = "cloud.google.com/gke-accelerator";

    private NodeLabels() {
    }

    public static Map<String, String> labelsOf(Node node) {
        if (node == null || node.getMetadata() == null || node.getMetadata().getLabels() == null) {
            return Collections.emptyMap();
        }
        return node.getMetadata().getLabels();
    }

    /**
     * 인스턴스 타입 조회 (stable 키 우선, 없으면 legacy 키)
     */
    public static Optional<String> instanceType(Map<String, String> labels) {
        if (labels.containsKey(INSTANCE_TYPE_STABLE)) {
            return Optional.ofNullable(labels.get(INSTANCE_TYPE_STABLE));
        }
        return Optional.ofNullable(labels.get(INSTANCE_TYPE_LEGACY));
    }

    /**
     * Spot VM은 실제로는 동적 가격이지만, 가격 비교 목적상 Preemptible VM과 동일하게 취급한다.
     * Spot VM은 항상 대응하는 일반 VM보다 저렴하다.
     */
    public static boolean hasPreemptiblePricing(Node node) {
        Map<String, String> labels = labelsOf(node);
        return "true".equals(labels.get(PREEMPTIBLE)) || "true".equals(labels.get(SPOT));
    }
}
