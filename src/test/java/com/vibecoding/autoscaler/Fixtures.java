package com.vibecoding.autoscaler;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 Node/Pod 생성 헬퍼
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Map<String, Quantity> resources(String... nameAndAmount) {
        Map<String, Quantity> resources = new HashMap<>();
        for (int i = 0; i < nameAndAmount.length; i += 2) {
            resources.put(nameAndAmount[i], new Quantity(nameAndAmount[i + 1]));
        }
        return resources;
    }

    public static Node node(String name, Map<String, String> labels,
                            Map<String, Quantity> capacity, Map<String, Quantity> allocatable) {
        return new NodeBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withLabels(labels)
                .endMetadata()
                .withNewStatus()
                    .withCapacity(capacity)
                    .withAllocatable(allocatable)
                .endStatus()
                .build();
    }

    public static Node node(String name, Map<String, String> labels, Map<String, Quantity> capacity) {
        return node(name, labels, capacity, capacity);
    }

    @SafeVarargs
    public static Pod pod(String name, Map<String, Quantity>... containerRequests) {
        List<Container> containers = new ArrayList<>();
        for (int i = 0; i < containerRequests.length; i++) {
            containers.add(new ContainerBuilder()
                    .withName("c" + i)
                    .withNewResources()
                        .withRequests(containerRequests[i])
                    .endResources()
                    .build());
        }
        return new PodBuilder()
                .withNewMetadata()
                    .withNamespace("default")
                    .withName(name)
                .endMetadata()
                .withNewSpec()
                    .withContainers(containers)
                .endSpec()
                .build();
    }

    public static Pod daemonSetPod(String name, Map<String, Quantity> requests) {
        return new PodBuilder(pod(name, requests))
                .editMetadata()
                    .addNewOwnerReference()
                        .withApiVersion("apps/v1")
                        .withKind("DaemonSet")
                        .withName("ds-" + name)
                        .withUid("uid-" + name)
                        .withController(true)
                    .endOwnerReference()
                .endMetadata()
                .build();
    }

    public static Pod mirrorPod(String name, Map<String, Quantity> requests) {
        return new PodBuilder(pod(name, requests))
                .editMetadata()
                    .addToAnnotations("kubernetes.io/config.mirror", "mirror-hash")
                .endMetadata()
                .build();
    }

    public static Pod terminatingPod(String name, Map<String, Quantity> requests, Instant deletedAt) {
        return new PodBuilder(pod(name, requests))
                .editMetadata()
                    .withDeletionTimestamp(deletedAt.toString())
                .endMetadata()
                .build();
    }
}
