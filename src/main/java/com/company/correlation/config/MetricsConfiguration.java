package com.company.correlation.config;

import com.company.correlation.service.AlertCorrelationEngine;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder correlationMetrics(AlertCorrelationEngine engine) {
        return (registry) -> {
            // Unresolved groups held in memory
            Gauge.builder("correlation.groups.active", engine, e -> {
                        try {
                            return e.activeGroupCount();
                        } catch (Exception ex) {
                            log.warn("Failed to count active groups", ex);
                            return 0;
                        }
                    })
                    .description("Number of open or suppressed alert groups")
                    .register(registry);

            log.info("Correlation metrics registered");
        };
    }
}
