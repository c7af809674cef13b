package com.vibecoding.autoscaler.config;

import com.vibecoding.autoscaler.pricing.StaticPriceCatalog;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 가격표 설정 (application.yml 의 pricing.*)
 */
@ConfigurationProperties(prefix = "pricing")
@Data
public class PricingProperties {

    private static final Logger log = LoggerFactory.getLogger(PricingProperties.class);

    private double baseCpuPricePerHour;
    private double baseMemoryPricePerHourPerGb;
    private double baseGpuPricePerHour;
    private double defaultPreemptibleDiscount = 1.0;

    private Map<String, Double> predefinedCpuPricePerHour = new HashMap<>();
    private Map<String, Double> customCpuPricePerHour = new HashMap<>();
    private Map<String, Double> predefinedMemoryPricePerHourPerGb = new HashMap<>();
    private Map<String, Double> customMemoryPricePerHourPerGb = new HashMap<>();
    private Map<String, Double> instancePrices = new HashMap<>();
    private Map<String, Double> preemptibleInstancePrices = new HashMap<>();
    private Map<String, Double> gpuPrices = new HashMap<>();
    private Map<String, Double> preemptibleGpuPrices = new HashMap<>();
    private Map<String, Double> predefinedPreemptibleDiscount = new HashMap<>();
    private Map<String, Double> customPreemptibleDiscount = new HashMap<>();

    @PostConstruct
    public void init() {
        validateConfig();
    }

    /**
     * 가격표를 한 번 만들어 값 검증 (StaticPriceCatalog 생성자가 검사)
     */
    public void validateConfig() {
        try {
            toCatalog();
        } catch (IllegalStateException e) {
            log.error("Invalid pricing configuration: {}", e.getMessage());
            throw e;
        }

        log.info("Pricing configuration validated successfully");
        log.info("  - Base CPU: ${}/core-hour, memory: ${}/GiB-hour, GPU: ${}/hour",
                baseCpuPricePerHour, baseMemoryPricePerHourPerGb, baseGpuPricePerHour);
        log.info("  - Instance types: {} (preemptible: {})", instancePrices.size(), preemptibleInstancePrices.size());
        log.info("  - GPU types: {} (preemptible: {})", gpuPrices.size(), preemptibleGpuPrices.size());
        log.info("  - Default preemptible discount: {}", defaultPreemptibleDiscount);
    }

    /**
     * 현재 설정값의 불변 스냅샷
     */
    public StaticPriceCatalog toCatalog() {
        return StaticPriceCatalog.builder()
                .baseCpuPricePerHour(baseCpuPricePerHour)
                .baseMemoryPricePerHourPerGb(baseMemoryPricePerHourPerGb)
                .baseGpuPricePerHour(baseGpuPricePerHour)
                .defaultPreemptibleDiscount(defaultPreemptibleDiscount)
                .predefinedCpuPricePerHour(predefinedCpuPricePerHour)
                .customCpuPricePerHour(customCpuPricePerHour)
                .predefinedMemoryPricePerHourPerGb(predefinedMemoryPricePerHourPerGb)
                .customMemoryPricePerHourPerGb(customMemoryPricePerHourPerGb)
                .instancePrices(instancePrices)
                .preemptibleInstancePrices(preemptibleInstancePrices)
                .gpuPrices(gpuPrices)
                .preemptibleGpuPrices(preemptibleGpuPrices)
                .predefinedPreemptibleDiscount(predefinedPreemptibleDiscount)
                .customPreemptibleDiscount(customPreemptibleDiscount)
                .build();
    }
}
