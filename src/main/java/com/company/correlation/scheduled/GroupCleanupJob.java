package com.company.correlation.scheduled;

import com.company.correlation.service.GroupLifecycleManager;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodic group garbage collection (every minute by default)
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "correlation.lifecycle.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class GroupCleanupJob {

    private final GroupLifecycleManager lifecycleManager;
    private final MeterRegistry meterRegistry;

    @Scheduled(
            fixedDelayString = "${correlation.lifecycle.sweep-interval-ms:60000}",
            initialDelayString = "${correlation.lifecycle.initial-delay-ms:60000}"
    )
    public void cleanupExpiredGroups() {
        Instant startTime = Instant.now();

        try {
            int removed = lifecycleManager.sweep();

            meterRegistry.counter("correlation.groups.expired").increment(removed);
            meterRegistry.timer("correlation.cleanup.duration")
                    .record(Duration.between(startTime, Instant.now()));

            log.debug("Group cleanup finished: {} removed", removed);

        } catch (Exception e) {
            log.error("Group cleanup failed", e);
        }
    }
}
