package com.company.correlation.config;

import com.company.correlation.cache.GroupSnapshotPersister;
import com.company.correlation.correlation.rule.RuleRegistry;
import com.company.correlation.domain.CorrelationRule;
import com.company.correlation.event.GroupEventDispatcher;
import com.company.correlation.event.GroupEventListener;
import com.company.correlation.service.AlertCorrelationEngine;
import com.company.correlation.service.CorrelationStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

@Configuration
@Slf4j
public class CorrelationEngineConfig {

    @Bean
    public Clock correlationClock() {
        return Clock.systemUTC();
    }

    /**
     * Engine with the configured rule set and every listener bean attached.
     * An invalid configured rule fails startup.
     */
    @Bean
    public AlertCorrelationEngine alertCorrelationEngine(
            RuleRegistry ruleRegistry,
            GroupSnapshotPersister snapshotPersister,
            GroupEventDispatcher eventDispatcher,
            CorrelationStatistics statistics,
            CorrelationProperties properties,
            Clock clock,
            @Qualifier("correlationSideEffectExecutor") ThreadPoolTaskExecutor sideEffectExecutor,
            List<GroupEventListener> listeners) {

        AlertCorrelationEngine engine = new AlertCorrelationEngine(
                ruleRegistry, snapshotPersister, eventDispatcher, statistics,
                properties, clock, sideEffectExecutor);

        for (CorrelationRule rule : properties.getRules()) {
            engine.addRule(rule);
        }
        listeners.forEach(engine::registerListener);

        log.info("Alert correlation engine started with {} rules ({} enabled), max {} groups",
                ruleRegistry.size(), ruleRegistry.enabledCount(), properties.getMaxGroups());
        return engine;
    }
}
