package com.company.correlation.correlation.store;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Live groups and alert ownership. Not thread-safe: every call happens under the engine lock.
 */
public class AlertGroupStore {

    // Resolved groups go first, then least recently updated
    private static final Comparator<AlertGroup> EVICTION_ORDER =
            Comparator.comparing((AlertGroup group) -> group.getStatus() != GroupStatus.RESOLVED)
                    .thenComparing(AlertGroup::getLastUpdated);

    private final Map<String, AlertGroup> groups = new LinkedHashMap<>();
    private final Map<String, String> ownership = new HashMap<>();

    public void add(AlertGroup group) {
        groups.put(group.getId(), group);
        for (String alertId : group.getMemberIds()) {
            ownership.put(alertId, group.getId());
        }
    }

    public void assign(String alertId, String groupId) {
        ownership.put(alertId, groupId);
    }

    public Optional<AlertGroup> get(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public Optional<AlertGroup> findByAlert(String alertId) {
        String groupId = ownership.get(alertId);
        return groupId == null ? Optional.empty() : get(groupId);
    }

    /**
     * Remove a group together with the ownership of every member
     */
    public Optional<AlertGroup> remove(String groupId) {
        AlertGroup removed = groups.remove(groupId);
        if (removed == null) {
            return Optional.empty();
        }
        for (String alertId : removed.getMemberIds()) {
            ownership.remove(alertId, groupId);
        }
        return Optional.of(removed);
    }

    public List<AlertGroup> removeIf(Predicate<AlertGroup> condition) {
        List<String> ids = groups.values().stream()
                .filter(condition)
                .map(AlertGroup::getId)
                .collect(Collectors.toList());

        List<AlertGroup> removed = new ArrayList<>(ids.size());
        for (String id : ids) {
            remove(id).ifPresent(removed::add);
        }
        return removed;
    }

    /**
     * Open groups touched within the horizon. Suppressed and resolved groups take no new members.
     */
    public List<AlertGroup> candidates(Instant now, Duration horizon) {
        List<AlertGroup> candidates = new ArrayList<>();
        for (AlertGroup group : groups.values()) {
            if (group.getStatus() != GroupStatus.OPEN) continue;
            if (Duration.between(group.getLastUpdated(), now).compareTo(horizon) <= 0) {
                candidates.add(group);
            }
        }
        return candidates;
    }

    /**
     * Evict groups until no more than {@code maxGroups} remain, never touching {@code protectedId}
     */
    public List<AlertGroup> evictOverflow(int maxGroups, String protectedId) {
        int overflow = groups.size() - maxGroups;
        if (overflow <= 0) {
            return List.of();
        }

        List<String> victims = groups.values().stream()
                .filter(group -> !group.getId().equals(protectedId))
                .sorted(EVICTION_ORDER)
                .limit(overflow)
                .map(AlertGroup::getId)
                .collect(Collectors.toList());

        List<AlertGroup> evicted = new ArrayList<>(victims.size());
        for (String id : victims) {
            remove(id).ifPresent(evicted::add);
        }
        return evicted;
    }

    public Collection<AlertGroup> all() {
        return groups.values();
    }

    public int size() {
        return groups.size();
    }

    public int ownedAlertCount() {
        return ownership.size();
    }

    public long countActive() {
        return groups.values().stream()
                .filter(group -> group.getStatus() != GroupStatus.RESOLVED)
                .count();
    }

    public long countByStatus(GroupStatus status) {
        return groups.values().stream()
                .filter(group -> group.getStatus() == status)
                .count();
    }
}
