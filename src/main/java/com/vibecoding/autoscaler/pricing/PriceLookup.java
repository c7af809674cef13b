package com.vibecoding.autoscaler.pricing;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * "키별 가격 → 기본 가격" 조회 정책
 *
 * CPU, 메모리, GPU, 인스턴스, 할인율 조회가 모두 이 규칙을 따른다.
 */
public final class PriceLookup {

    private PriceLookup() {
    }

    public static OptionalDouble find(String key, Map<String, Double> table) {
        if (key == null || table == null) {
            return OptionalDouble.empty();
        }
        Double value = table.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * 앞쪽 테이블부터 key 를 찾아 처음 발견된 값을 반환하고, 어디에도 없으면 fallback
     */
    @SafeVarargs
    public static double resolve(String key, double fallback, Map<String, Double>... tables) {
        for (Map<String, Double> table : tables) {
            OptionalDouble price = find(key, table);
            if (price.isPresent()) {
                return price.getAsDouble();
            }
        }
        return fallback;
    }
}
