package com.vibecoding.autoscaler.pricing;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

import java.time.Instant;

/**
 * 노드/Pod 실행 비용 추정 인터페이스 (USD)
 *
 * endTime 은 startTime 이후여야 한다. 구간이 뒤집힌 경우의 결과는 정의되지 않는다.
 */
public interface PriceModel {

    /**
     * 주어진 기간 동안 노드를 실행하는 비용
     */
    double nodePrice(Node node, Instant startTime, Instant endTime);

    /**
     * 크기가 정확히 맞는 머신에서 Pod 을 실행할 때의 이론상 최소 비용
     */
    double podPrice(Pod pod, Instant startTime, Instant endTime);
}
