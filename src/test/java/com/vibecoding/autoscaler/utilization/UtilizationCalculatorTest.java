package com.vibecoding.autoscaler.utilization;

import com.vibecoding.autoscaler.config.UtilizationProperties;
import com.vibecoding.autoscaler.exception.ResourceUtilizationException;
import com.vibecoding.autoscaler.model.NodeInfo;
import com.vibecoding.autoscaler.model.UtilizationInfo;
import io.fabric8.kubernetes.api.model.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static com.vibecoding.autoscaler.Fixtures.daemonSetPod;
import static com.vibecoding.autoscaler.Fixtures.mirrorPod;
import static com.vibecoding.autoscaler.Fixtures.node;
import static com.vibecoding.autoscaler.Fixtures.pod;
import static com.vibecoding.autoscaler.Fixtures.resources;
import static com.vibecoding.autoscaler.Fixtures.terminatingPod;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UtilizationCalculatorTest {

    private static final double EPSILON = 1e-9;
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final String GPU_LABEL = "cloud.google.com/gke-accelerator";

    private UtilizationProperties properties;
    private UtilizationCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = new UtilizationProperties();
        calculator = new UtilizationCalculator(properties);
    }

    private static Node cpuNode() {
        return node("node-1", Map.of(), resources("cpu", "2", "memory", "4Gi"));
    }

    private static NodeInfo regularAndDaemonSet() {
        return NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "500m", "memory", "1Gi")))
                .pod(daemonSetPod("agent", resources("cpu", "300m")))
                .build();
    }

    @Test
    void daemonSetRequestsAreSubtractedFromAllocatableWhenSkipped() {
        double skipped = calculator.calculateUtilizationOfResource(regularAndDaemonSet(), "cpu", true, false, NOW);
        double counted = calculator.calculateUtilizationOfResource(regularAndDaemonSet(), "cpu", false, false, NOW);

        assertThat(skipped).isCloseTo(500.0 / 1700.0, within(EPSILON));
        assertThat(counted).isCloseTo(0.4, within(EPSILON));
    }

    @Test
    void mirrorPodsAreTreatedLikeDaemonSetPods() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "500m")))
                .pod(mirrorPod("kube-proxy", resources("cpu", "100m", "memory", "512Mi")))
                .build();

        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", false, true, NOW))
                .isCloseTo(500.0 / 1900.0, within(EPSILON));
        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", false, false, NOW))
                .isCloseTo(600.0 / 2000.0, within(EPSILON));
    }

    @Test
    void longTerminatingPodsAreExcludedFromNumeratorAndDenominator() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "500m")))
                .pod(terminatingPod("stuck", resources("cpu", "1"), NOW.minusSeconds(600)))
                .build();

        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", false, false, NOW))
                .isCloseTo(0.25, within(EPSILON));
        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", true, true, NOW))
                .isCloseTo(0.25, within(EPSILON));
    }

    @Test
    void recentlyDeletedPodsStillCount() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(terminatingPod("leaving", resources("cpu", "1"), NOW.minusSeconds(10)))
                .build();

        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", true, true, NOW))
                .isCloseTo(0.5, within(EPSILON));
    }

    @Test
    void requestsAreSummedAcrossContainers() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "100m"), resources("cpu", "200m"), resources("memory", "1Gi")))
                .build();

        assertThat(calculator.calculateUtilizationOfResource(nodeInfo, "cpu", true, true, NOW))
                .isCloseTo(0.15, within(EPSILON));
    }

    @Test
    void calculateReportsDominantResource() {
        UtilizationInfo info = calculator.calculate(regularAndDaemonSet(), true, false, GPU_LABEL, NOW);

        assertThat(info.getCpuUtil()).isCloseTo(500.0 / 1700.0, within(EPSILON));
        assertThat(info.getMemUtil()).isCloseTo(0.25, within(EPSILON));
        assertThat(info.getGpuUtil()).isZero();
        assertThat(info.getResourceName()).isEqualTo("cpu");
        assertThat(info.getUtilization()).isEqualTo(info.getCpuUtil());
    }

    @Test
    void memoryWinsTies() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "1", "memory", "2Gi")))
                .build();

        UtilizationInfo info = calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW);

        assertThat(info.getResourceName()).isEqualTo("memory");
        assertThat(info.getUtilization()).isCloseTo(0.5, within(EPSILON));
    }

    @Test
    void emptyNodeHasZeroUtilization() {
        UtilizationInfo info = calculator.calculate(NodeInfo.builder().node(cpuNode()).build(), true, true, GPU_LABEL, NOW);

        assertThat(info.getUtilization()).isZero();
        assertThat(info.getResourceName()).isEqualTo("memory");
    }

    @Test
    void gpuNodeReportsOnlyGpuUtilization() {
        Node gpuNode = node("gpu-1", Map.of(GPU_LABEL, "nvidia-tesla-t4"),
                resources("cpu", "2", "memory", "4Gi", "nvidia.com/gpu", "2"));
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(gpuNode)
                .pod(pod("trainer", resources("cpu", "1900m", "memory", "3900Mi", "nvidia.com/gpu", "1")))
                .build();

        UtilizationInfo info = calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW);

        assertThat(info.getGpuUtil()).isCloseTo(0.5, within(EPSILON));
        assertThat(info.getUtilization()).isCloseTo(0.5, within(EPSILON));
        assertThat(info.getResourceName()).isEqualTo("nvidia.com/gpu");
        assertThat(info.getCpuUtil()).isZero();
        assertThat(info.getMemUtil()).isZero();
    }

    @Test
    void unreadyGpuYieldsZeroUtilizationInsteadOfError() {
        // 라벨은 있지만 드라이버 설치 전이라 allocatable 에 GPU 가 없음
        Node gpuNode = node("gpu-1", Map.of(GPU_LABEL, "nvidia-tesla-t4"),
                resources("cpu", "2", "memory", "4Gi"));
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(gpuNode)
                .pod(pod("app", resources("cpu", "1")))
                .build();

        UtilizationInfo info = calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW);

        assertThat(info.getUtilization()).isZero();
        assertThat(info.getGpuUtil()).isZero();
        assertThat(info.getResourceName()).isEqualTo("nvidia.com/gpu");
    }

    @Test
    void zeroAllocatableGpuYieldsZeroUtilizationInsteadOfError() {
        Node gpuNode = node("gpu-1", Map.of(GPU_LABEL, "nvidia-tesla-t4"),
                resources("cpu", "2", "memory", "4Gi", "nvidia.com/gpu", "0"));
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(gpuNode)
                .pod(pod("app", resources("cpu", "1", "nvidia.com/gpu", "1")))
                .build();

        UtilizationInfo info = calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW);

        assertThat(info.getUtilization()).isZero();
        assertThat(info.getGpuUtil()).isZero();
        assertThat(info.getResourceName()).isEqualTo("nvidia.com/gpu");
    }

    @Test
    void gpuTakenByDaemonSetsYieldsZeroUtilizationInsteadOfError() {
        Node gpuNode = node("gpu-1", Map.of(GPU_LABEL, "nvidia-tesla-t4"),
                resources("cpu", "2", "memory", "4Gi", "nvidia.com/gpu", "1"));
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(gpuNode)
                .pod(pod("app", resources("nvidia.com/gpu", "1")))
                .pod(daemonSetPod("gpu-agent", resources("nvidia.com/gpu", "1")))
                .build();

        assertThatThrownBy(() -> calculator.calculateUtilizationOfResource(nodeInfo, "nvidia.com/gpu", true, true, NOW))
                .isInstanceOf(ResourceUtilizationException.class)
                .extracting("reason")
                .isEqualTo(ResourceUtilizationException.Reason.NO_CAPACITY_LEFT);

        UtilizationInfo info = calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW);

        assertThat(info.getUtilization()).isZero();
        assertThat(info.getGpuUtil()).isZero();
        assertThat(info.getResourceName()).isEqualTo("nvidia.com/gpu");
    }

    @Test
    void zeroAllocatableIsAnError() {
        Node node = node("node-1", Map.of(), resources("cpu", "0", "memory", "4Gi"));
        NodeInfo nodeInfo = NodeInfo.builder().node(node).build();

        assertThatThrownBy(() -> calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW))
                .isInstanceOf(ResourceUtilizationException.class)
                .hasMessage("cpu is 0 at node-1")
                .satisfies(e -> {
                    ResourceUtilizationException error = (ResourceUtilizationException) e;
                    assertThat(error.getReason()).isEqualTo(ResourceUtilizationException.Reason.RESOURCE_ZERO);
                    assertThat(error.getNodeName()).isEqualTo("node-1");
                    assertThat(error.getResourceName()).isEqualTo("cpu");
                });
    }

    @Test
    void missingAllocatableIsAnError() {
        Node node = node("node-1", Map.of(), resources("cpu", "2"));
        NodeInfo nodeInfo = NodeInfo.builder().node(node).build();

        assertThatThrownBy(() -> calculator.calculate(nodeInfo, true, true, GPU_LABEL, NOW))
                .isInstanceOf(ResourceUtilizationException.class)
                .hasMessage("failed to get memory from node-1")
                .satisfies(e -> {
                    ResourceUtilizationException error = (ResourceUtilizationException) e;
                    assertThat(error.getReason()).isEqualTo(ResourceUtilizationException.Reason.RESOURCE_MISSING);
                    assertThat(error.getNodeName()).isEqualTo("node-1");
                    assertThat(error.getResourceName()).isEqualTo("memory");
                });
    }

    @Test
    void exhaustedAllocatableIsAnErrorNotInfinity() {
        NodeInfo nodeInfo = NodeInfo.builder()
                .node(cpuNode())
                .pod(pod("app", resources("cpu", "100m")))
                .pod(daemonSetPod("greedy", resources("cpu", "2")))
                .build();

        assertThatThrownBy(() -> calculator.calculateUtilizationOfResource(nodeInfo, "cpu", true, false, NOW))
                .isInstanceOf(ResourceUtilizationException.class)
                .extracting("reason")
                .isEqualTo(ResourceUtilizationException.Reason.NO_CAPACITY_LEFT);
    }

    @Test
    void configuredDefaultsAreUsedByShortOverload() {
        assertThat(calculator.calculate(regularAndDaemonSet(), NOW).getCpuUtil())
                .isCloseTo(500.0 / 1700.0, within(EPSILON));

        properties.setSkipDaemonSetPods(false);

        assertThat(calculator.calculate(regularAndDaemonSet(), NOW).getCpuUtil())
                .isCloseTo(0.4, within(EPSILON));
    }
}
