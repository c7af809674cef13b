package com.vibecoding.autoscaler.model;

import lombok.Builder;
import lombok.Value;

/**
 * 노드 사용률 계산 결과
 *
 * GPU 노드는 gpuUtil 만, 일반 노드는 cpuUtil/memUtil 만 채워진다.
 */
@Value
@Builder
public class UtilizationInfo {
    double cpuUtil;
    double memUtil;
    double gpuUtil;
    String resourceName;      // 사용률이 가장 높은 리소스 (cpu, memory, nvidia.com/gpu)
    double utilization;       // max(cpuUtil, memUtil) 또는 gpuUtil
}
