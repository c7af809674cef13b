package com.vibecoding.autoscaler.config;

import com.vibecoding.autoscaler.util.NodeLabels;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 사용률 계산 기본 옵션
 */
@ConfigurationProperties(prefix = "utilization")
@Data
public class UtilizationProperties {

    private boolean skipDaemonSetPods = true;
    private boolean skipMirrorPods = true;

    // 이 라벨이 붙은 노드는 GPU 노드로 취급
    private String gpuLabel = NodeLabels.GKE_ACCELERATOR;
}
