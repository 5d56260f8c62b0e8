package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlertSeverity;
import com.company.correlation.domain.enums.GroupStatus;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate of alerts judged to describe the same incident.
 * <p>
 * The engine holds the live instance under its lock; everything handed to callers or
 * listeners is a {@link #copy()}.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class AlertGroup {

    @ToString.Include
    private final String id;
    @ToString.Include
    private final String rootAlertId;
    private final Instant createdAt;

    private final LinkedHashMap<String, Alert> members = new LinkedHashMap<>();
    private final LinkedHashSet<String> contributingRules = new LinkedHashSet<>();
    private final Map<String, Map<String, Object>> evidence = new LinkedHashMap<>();

    @ToString.Include
    private double confidenceScore;
    private Instant lastUpdated;
    @ToString.Include
    private GroupStatus status;

    public AlertGroup(String id, Alert rootAlert, Instant createdAt) {
        this.id = id;
        this.rootAlertId = rootAlert.getId();
        this.createdAt = createdAt;
        this.lastUpdated = createdAt;
        this.status = GroupStatus.OPEN;
        this.confidenceScore = 0.0;
        this.members.put(rootAlert.getId(), rootAlert);
    }

    private AlertGroup(AlertGroup source) {
        this.id = source.id;
        this.rootAlertId = source.rootAlertId;
        this.createdAt = source.createdAt;
        this.lastUpdated = source.lastUpdated;
        this.status = source.status;
        this.confidenceScore = source.confidenceScore;
        this.members.putAll(source.members);
        this.contributingRules.addAll(source.contributingRules);
        source.evidence.forEach((rule, entries) -> this.evidence.put(rule, new LinkedHashMap<>(entries)));
    }

    /**
     * Merge a correlated alert into the group
     */
    public void addMember(Alert alert, String ruleName, double score,
                          Map<String, Object> outcomeEvidence, Instant now) {
        if (members.containsKey(alert.getId())) {
            return;
        }
        members.put(alert.getId(), alert);
        contributingRules.add(ruleName);
        confidenceScore = Math.max(confidenceScore, score);
        if (outcomeEvidence != null && !outcomeEvidence.isEmpty()) {
            evidence.put(ruleName, new LinkedHashMap<>(outcomeEvidence));
        }
        lastUpdated = now;
    }

    /**
     * Forward-only status change; throws when the transition is not allowed
     */
    public void transitionTo(GroupStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Group " + id + " cannot move from " + status + " to " + target);
        }
        status = target;
        lastUpdated = now;
    }

    /**
     * The single permitted backward transition
     */
    public void reopen(Instant now) {
        if (status == GroupStatus.OPEN) {
            throw new IllegalStateException("Group " + id + " is already open");
        }
        status = GroupStatus.OPEN;
        lastUpdated = now;
    }

    public int memberCount() {
        return members.size();
    }

    /**
     * Members other than the root alert
     */
    public int correlatedCount() {
        return members.size() - 1;
    }

    public Set<String> getMemberIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(members.keySet()));
    }

    public List<Alert> getMembers() {
        return Collections.unmodifiableList(new ArrayList<>(members.values()));
    }

    public Set<String> getContributingRules() {
        return Collections.unmodifiableSet(contributingRules);
    }

    public Map<String, Map<String, Object>> getEvidence() {
        return Collections.unmodifiableMap(evidence);
    }

    public Alert getRootAlert() {
        return members.get(rootAlertId);
    }

    public AlertSeverity highestSeverity() {
        AlertSeverity highest = null;
        for (Alert alert : members.values()) {
            if (alert.getSeverity() != null && alert.getSeverity().isHigherThan(highest)) {
                highest = alert.getSeverity();
            }
        }
        return highest != null ? highest : AlertSeverity.INFO;
    }

    public AlertGroup copy() {
        return new AlertGroup(this);
    }
}
