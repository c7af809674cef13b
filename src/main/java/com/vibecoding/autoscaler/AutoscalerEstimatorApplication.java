package com.vibecoding.autoscaler;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class AutoscalerEstimatorApplication {

    private static final Logger log = LoggerFactory.getLogger(AutoscalerEstimatorApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  Autoscaler Estimator - node price & utilization");
        log.info("==============================================");

        // .env 파일의 값을 시스템 프로퍼티로 등록 (예: pricing.base-gpu-price-per-hour=0.95)
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
                System.setProperty(entry.getKey(), entry.getValue());
                log.debug("Loaded environment variable: {}", entry.getKey());
            });

            log.info("Environment variables loaded from .env file");
        } catch (DotenvException e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }

        SpringApplication.run(AutoscalerEstimatorApplication.class, args);

        log.info("Estimator context started successfully!");
    }
}
