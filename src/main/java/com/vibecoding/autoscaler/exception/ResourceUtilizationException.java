package com.vibecoding.autoscaler.exception;

import lombok.Getter;

/**
 * 노드 할당 가능 리소스로 사용률을 계산할 수 없을 때 발생하는 예외
 */
@Getter
public class ResourceUtilizationException extends RuntimeException {

    public enum Reason {
        RESOURCE_MISSING,   // allocatable 에 해당 리소스 없음
        RESOURCE_ZERO,      // allocatable 이 0
        NO_CAPACITY_LEFT    // DaemonSet/미러 Pod 제외 후 남은 용량이 0 이하
    }

    private final Reason reason;
    private final String nodeName;
    private final String resourceName;

    public ResourceUtilizationException(Reason reason, String nodeName, String resourceName, String message) {
        super(message);
        this.reason = reason;
        this.nodeName = nodeName;
        this.resourceName = resourceName;
    }

    public static ResourceUtilizationException missing(String nodeName, String resourceName) {
        return new ResourceUtilizationException(Reason.RESOURCE_MISSING, nodeName, resourceName,
                String.format("failed to get %s from %s", resourceName, nodeName));
    }

    public static ResourceUtilizationException zero(String nodeName, String resourceName) {
        return new ResourceUtilizationException(Reason.RESOURCE_ZERO, nodeName, resourceName,
                String.format("%s is 0 at %s", resourceName, nodeName));
    }

    public static ResourceUtilizationException noCapacityLeft(String nodeName, String resourceName,
                                                              long allocatableMilli, long reservedMilli) {
        return new ResourceUtilizationException(Reason.NO_CAPACITY_LEFT, nodeName, resourceName,
                String.format("%s at %s has no capacity left after excluding daemonset/mirror pods (allocatable=%dm, excluded=%dm)",
                        resourceName, nodeName, allocatableMilli, reservedMilli));
    }
}
