package com.vibecoding.autoscaler.util;

import io.fabric8.kubernetes.api.model.Quantity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * fabric8 Quantity 정수 변환 유틸
 *
 * 쿠버네티스 Quantity 의미를 따른다: milli 값과 정수 값 모두 올림 처리.
 */
public final class Quantities {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private Quantities() {
    }

    /**
     * 1/1000 단위 값 (예: "500m" CPU → 500, "2" → 2000)
     */
    public static long milliValue(Quantity quantity) {
        if (quantity == null) {
            return 0L;
        }
        return Quantity.getAmountInBytes(quantity)
                .multiply(THOUSAND)
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    /**
     * 기본 단위 정수 값 (메모리는 바이트)
     */
    public static long value(Quantity quantity) {
        if (quantity == null) {
            return 0L;
        }
        return Quantity.getAmountInBytes(quantity)
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    public static long milliValue(Map<String, Quantity> resources, String resourceName) {
        return resources == null ? 0L : milliValue(resources.get(resourceName));
    }

    public static long value(Map<String, Quantity> resources, String resourceName) {
        return resources == null ? 0L : value(resources.get(resourceName));
    }
}
