package com.company.correlation.service;

import com.company.correlation.cache.GroupSnapshotPersister;
import com.company.correlation.config.CorrelationProperties;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Resolves idle groups, then garbage-collects groups that are too old or resolved long enough ago
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GroupLifecycleManager {

    private final AlertCorrelationEngine engine;
    private final GroupSnapshotPersister snapshotPersister;
    private final CorrelationProperties properties;
    private final Clock clock;

    /**
     * @return number of groups removed
     */
    public int sweep() {
        List<String> resolved = engine.resolveInactive(properties.getInactivityTimeout());
        if (!resolved.isEmpty()) {
            log.info("Resolved {} inactive groups", resolved.size());
        }

        Instant now = clock.instant();
        Duration maxAge = properties.getMaxGroupAge();
        Duration retention = properties.getResolvedRetention();

        List<AlertGroup> removed = engine.removeGroups(group -> isExpired(group, now, maxAge, retention));

        for (AlertGroup group : removed) {
            log.debug("Removed group {} ({}, created {})", group.getId(), group.getStatus(), group.getCreatedAt());
            snapshotPersister.delete(group.getId());
        }

        if (!removed.isEmpty()) {
            log.info("Group cleanup removed {} groups, {} remain", removed.size(), engine.groupCount());
        }
        return removed.size();
    }

    static boolean isExpired(AlertGroup group, Instant now, Duration maxAge, Duration retention) {
        if (Duration.between(group.getCreatedAt(), now).compareTo(maxAge) > 0) {
            return true;
        }
        return group.getStatus() == GroupStatus.RESOLVED
                && Duration.between(group.getLastUpdated(), now).compareTo(retention) > 0;
    }
}
