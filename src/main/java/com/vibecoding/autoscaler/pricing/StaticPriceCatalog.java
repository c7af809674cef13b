package com.vibecoding.autoscaler.pricing;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * 생성 시점에 고정되는 불변 가격표
 *
 * 빌더로 받은 맵은 모두 불변 복사본으로 보관한다.
 * 가격은 0 이상, 할인 계수는 [0, 1] 이어야 하며 위반 시 IllegalStateException.
 * 기본 할인 계수를 지정하지 않으면 1.0 (할인 없음).
 */
@Getter
@ToString
public final class StaticPriceCatalog implements PriceCatalog {

    private static final double NO_DISCOUNT = 1.0;

    private final double baseCpuPricePerHour;
    private final double baseMemoryPricePerHourPerGb;
    private final double baseGpuPricePerHour;
    private final double defaultPreemptibleDiscount;

    private final Map<String, Double> predefinedCpuPricePerHour;
    private final Map<String, Double> customCpuPricePerHour;
    private final Map<String, Double> predefinedMemoryPricePerHourPerGb;
    private final Map<String, Double> customMemoryPricePerHourPerGb;
    private final Map<String, Double> instancePrices;
    private final Map<String, Double> preemptibleInstancePrices;
    private final Map<String, Double> gpuPrices;
    private final Map<String, Double> preemptibleGpuPrices;
    private final Map<String, Double> predefinedPreemptibleDiscount;
    private final Map<String, Double> customPreemptibleDiscount;

    @Builder
    private StaticPriceCatalog(double baseCpuPricePerHour,
                               double baseMemoryPricePerHourPerGb,
                               double baseGpuPricePerHour,
                               Double defaultPreemptibleDiscount,
                               @Singular("predefinedCpuPrice") Map<String, Double> predefinedCpuPricePerHour,
                               @Singular("customCpuPrice") Map<String, Double> customCpuPricePerHour,
                               @Singular("predefinedMemoryPrice") Map<String, Double> predefinedMemoryPricePerHourPerGb,
                               @Singular("customMemoryPrice") Map<String, Double> customMemoryPricePerHourPerGb,
                               @Singular("instancePrice") Map<String, Double> instancePrices,
                               @Singular("preemptibleInstancePrice") Map<String, Double> preemptibleInstancePrices,
                               @Singular("gpuPrice") Map<String, Double> gpuPrices,
                               @Singular("preemptibleGpuPrice") Map<String, Double> preemptibleGpuPrices,
                               @Singular("predefinedDiscount") Map<String, Double> predefinedPreemptibleDiscount,
                               @Singular("customDiscount") Map<String, Double> customPreemptibleDiscount) {
        this.baseCpuPricePerHour = requireNonNegative("baseCpuPricePerHour", baseCpuPricePerHour);
        this.baseMemoryPricePerHourPerGb = requireNonNegative("baseMemoryPricePerHourPerGb", baseMemoryPricePerHourPerGb);
        this.baseGpuPricePerHour = requireNonNegative("baseGpuPricePerHour", baseGpuPricePerHour);
        this.defaultPreemptibleDiscount = requireDiscount("defaultPreemptibleDiscount",
                defaultPreemptibleDiscount == null ? NO_DISCOUNT : defaultPreemptibleDiscount);
        this.predefinedCpuPricePerHour = prices("predefinedCpuPricePerHour", predefinedCpuPricePerHour);
        this.customCpuPricePerHour = prices("customCpuPricePerHour", customCpuPricePerHour);
        this.predefinedMemoryPricePerHourPerGb = prices("predefinedMemoryPricePerHourPerGb", predefinedMemoryPricePerHourPerGb);
        this.customMemoryPricePerHourPerGb = prices("customMemoryPricePerHourPerGb", customMemoryPricePerHourPerGb);
        this.instancePrices = prices("instancePrices", instancePrices);
        this.preemptibleInstancePrices = prices("preemptibleInstancePrices", preemptibleInstancePrices);
        this.gpuPrices = prices("gpuPrices", gpuPrices);
        this.preemptibleGpuPrices = prices("preemptibleGpuPrices", preemptibleGpuPrices);
        this.predefinedPreemptibleDiscount = discounts("predefinedPreemptibleDiscount", predefinedPreemptibleDiscount);
        this.customPreemptibleDiscount = discounts("customPreemptibleDiscount", customPreemptibleDiscount);
    }

    private static Map<String, Double> prices(String name, Map<String, Double> table) {
        table.forEach((key, price) -> requireNonNegative(name + "." + key, price));
        return Map.copyOf(table);
    }

    private static Map<String, Double> discounts(String name, Map<String, Double> table) {
        table.forEach((key, discount) -> requireDiscount(name + "." + key, discount));
        return Map.copyOf(table);
    }

    private static double requireNonNegative(String name, double price) {
        if (!(price >= 0.0)) {
            throw new IllegalStateException(name + " must not be negative: " + price);
        }
        return price;
    }

    private static double requireDiscount(String name, double discount) {
        if (!(discount >= 0.0 && discount <= 1.0)) {
            throw new IllegalStateException(name + " must be within [0, 1]: " + discount);
        }
        return discount;
    }
}
