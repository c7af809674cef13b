package com.vibecoding.autoscaler.config;

import com.vibecoding.autoscaler.pricing.PriceCatalog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 가격표/사용률 설정 바인딩
 */
@Configuration
@EnableConfigurationProperties({PricingProperties.class, UtilizationProperties.class})
public class EstimatorConfig {

    @Bean
    public PriceCatalog priceCatalog(PricingProperties pricingProperties) {
        return pricingProperties.toCatalog();
    }
}
