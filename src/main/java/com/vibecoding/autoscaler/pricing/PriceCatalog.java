package com.vibecoding.autoscaler.pricing;

import java.util.Map;

/**
 * 가격 모델이 참조하는 가격표 (읽기 전용)
 *
 * 모든 가격은 USD 기준 시간당 가격. 패밀리 키는 인스턴스 타입의 첫 '-' 이전 부분
 * (예: "n1-standard-2" → "n1"), GPU 키는 GPU 타입 (예: "nvidia-tesla-t4").
 * 구현체는 생성 이후 변경되지 않아야 하며, 여러 스레드에서 동시에 읽을 수 있어야 한다.
 */
public interface PriceCatalog {

    double getBaseCpuPricePerHour();

    double getBaseMemoryPricePerHourPerGb();

    double getBaseGpuPricePerHour();

    /**
     * 패밀리별 할인율이 없을 때 적용하는 preemptible 할인 계수 (0~1)
     */
    double getDefaultPreemptibleDiscount();

    Map<String, Double> getPredefinedCpuPricePerHour();

    Map<String, Double> getCustomCpuPricePerHour();

    Map<String, Double> getPredefinedMemoryPricePerHourPerGb();

    Map<String, Double> getCustomMemoryPricePerHourPerGb();

    Map<String, Double> getInstancePrices();

    Map<String, Double> getPreemptibleInstancePrices();

    Map<String, Double> getGpuPrices();

    Map<String, Double> getPreemptibleGpuPrices();

    Map<String, Double> getPredefinedPreemptibleDiscount();

    Map<String, Double> getCustomPreemptibleDiscount();
}
