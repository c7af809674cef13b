package com.vibecoding.autoscaler.model;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 노드와 그 노드에 바인딩된 Pod 목록의 스냅샷
 */
@Value
@Builder
public class NodeInfo {
    Node node;
    @Singular
    List<Pod> pods;

    public String getNodeName() {
        if (node == null || node.getMetadata() == null) {
            return "<unknown>";
        }
        return node.getMetadata().getName();
    }
}
