package com.company.correlation.cache;

import com.company.correlation.config.CorrelationProperties;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.service.CorrelationStatistics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Best-effort snapshot persistence. Failures are logged and counted, never rethrown.
 */
@Component
@Slf4j
public class GroupSnapshotPersister {

    private final CacheClient cacheClient;
    private final ObjectMapper objectMapper;
    private final CorrelationStatistics statistics;
    private final CorrelationProperties properties;

    public GroupSnapshotPersister(CacheClient cacheClient,
                                  ObjectMapper objectMapper,
                                  CorrelationStatistics statistics,
                                  CorrelationProperties properties) {
        this.cacheClient = cacheClient;
        this.objectMapper = objectMapper;
        this.statistics = statistics;
        this.properties = properties;
    }

    public void save(AlertGroup group) {
        if (!properties.getCache().isEnabled()) {
            return;
        }
        String key = key(group.getId());
        try {
            byte[] payload = objectMapper.writeValueAsBytes(GroupSnapshot.from(group));
            cacheClient.set(key, payload, properties.getMaxGroupAge());
            log.debug("Persisted snapshot for group {} ({} members)", group.getId(), group.memberCount());

        } catch (CallNotPermittedException e) {
            log.warn("Snapshot cache circuit open, skipping persist of group {}", group.getId());
            statistics.recordPersistenceFailure();
        } catch (Exception e) {
            log.warn("Failed to persist snapshot for group {}: {}", group.getId(), e.getMessage());
            statistics.recordPersistenceFailure();
        }
    }

    public void delete(String groupId) {
        if (!properties.getCache().isEnabled()) {
            return;
        }
        try {
            cacheClient.delete(key(groupId));
        } catch (CallNotPermittedException e) {
            log.warn("Snapshot cache circuit open, skipping delete of group {}", groupId);
            statistics.recordPersistenceFailure();
        } catch (Exception e) {
            log.warn("Failed to delete snapshot for group {}: {}", groupId, e.getMessage());
            statistics.recordPersistenceFailure();
        }
    }

    public Optional<GroupSnapshot> load(String groupId) {
        if (!properties.getCache().isEnabled()) {
            return Optional.empty();
        }
        try {
            Optional<byte[]> payload = cacheClient.get(key(groupId));
            if (payload.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(payload.get(), GroupSnapshot.class));

        } catch (Exception e) {
            log.warn("Failed to load snapshot for group {}: {}", groupId, e.getMessage());
            statistics.recordPersistenceFailure();
            return Optional.empty();
        }
    }

    String key(String groupId) {
        return properties.getCache().getKeyPrefix() + groupId;
    }
}
