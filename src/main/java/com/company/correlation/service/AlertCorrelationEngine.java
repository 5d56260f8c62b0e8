package com.company.correlation.service;

import com.company.correlation.cache.GroupSnapshotPersister;
import com.company.correlation.config.CorrelationProperties;
import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.correlation.rule.RuleRegistry;
import com.company.correlation.correlation.store.AlertGroupStore;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.CorrelationRule;
import com.company.correlation.domain.CorrelationStats;
import com.company.correlation.domain.GroupReference;
import com.company.correlation.domain.enums.CorrelationConfidence;
import com.company.correlation.domain.enums.GroupAction;
import com.company.correlation.domain.enums.GroupEventType;
import com.company.correlation.domain.enums.GroupStatus;
import com.company.correlation.event.GroupEventDispatcher;
import com.company.correlation.event.GroupEventListener;
import com.company.correlation.exception.InvalidAlertException;
import com.company.correlation.exception.RuleNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Assigns each incoming alert to exactly one group.
 * <p>
 * Every rule that applies to the alert is evaluated against every candidate group and the
 * highest-scoring match wins. A winning score of {@link CorrelationConfidence#HIGH} or better
 * merges the alert into that group; anything weaker opens a new group with the alert as root.
 * <p>
 * All reads and writes of group state happen under a single lock. Snapshot persistence and
 * listener callbacks are handed to the side-effect executor and never block {@link #process}.
 */
@Slf4j
public class AlertCorrelationEngine {

    private static final CorrelationConfidence MERGE_CONFIDENCE = CorrelationConfidence.HIGH;

    private final RuleRegistry ruleRegistry;
    private final GroupSnapshotPersister snapshotPersister;
    private final GroupEventDispatcher eventDispatcher;
    private final CorrelationStatistics statistics;
    private final CorrelationProperties properties;
    private final Clock clock;
    private final Executor sideEffectExecutor;

    private final AlertGroupStore store = new AlertGroupStore();
    private final ReentrantLock lock = new ReentrantLock();

    public AlertCorrelationEngine(RuleRegistry ruleRegistry,
                                  GroupSnapshotPersister snapshotPersister,
                                  GroupEventDispatcher eventDispatcher,
                                  CorrelationStatistics statistics,
                                  CorrelationProperties properties,
                                  Clock clock,
                                  Executor sideEffectExecutor) {
        this.ruleRegistry = ruleRegistry;
        this.snapshotPersister = snapshotPersister;
        this.eventDispatcher = eventDispatcher;
        this.statistics = statistics;
        this.properties = properties;
        this.clock = clock;
        this.sideEffectExecutor = sideEffectExecutor;
    }

    /**
     * Correlate one alert.
     *
     * @return the owning group, or empty for a rejected alert nobody owns
     * @throws InvalidAlertException if the alert has no id or trigger time
     */
    public Optional<GroupReference> process(Alert alert) {
        validate(alert);
        long started = System.nanoTime();

        lock.lock();
        try {
            Optional<AlertGroup> owner = store.findByAlert(alert.getId());

            if (alert.isResolved() || alert.isSynthetic()) {
                log.debug("Rejected alert {} (status {}, synthetic {})",
                        alert.getId(), alert.getStatus(), alert.isSynthetic());
                statistics.recordRejected();
                return owner.map(group -> GroupReference.of(group, GroupAction.EXISTING, null));
            }

            if (owner.isPresent()) {
                log.debug("Alert {} already belongs to group {}", alert.getId(), owner.get().getId());
                statistics.recordDuplicate();
                return Optional.of(GroupReference.of(owner.get(), GroupAction.EXISTING, null));
            }

            Instant now = clock.instant();
            Match best = findBestMatch(alert, ruleRegistry.applicableTo(alert), now);

            if (best != null && best.outcome.confidence().isAtLeast(MERGE_CONFIDENCE)) {
                return Optional.of(merge(alert, best, now));
            }
            return Optional.of(createGroup(alert, now));

        } finally {
            lock.unlock();
            statistics.recordProcessed(System.nanoTime() - started);
        }
    }

    private Match findBestMatch(Alert alert, List<RegisteredRule> rules, Instant now) {
        if (rules.isEmpty()) {
            return null;
        }

        Duration horizon = rules.stream()
                .map(RegisteredRule::getTimeWindow)
                .max(Comparator.naturalOrder())
                .orElse(Duration.ZERO);

        Match best = null;
        for (AlertGroup group : store.candidates(now, horizon)) {
            for (RegisteredRule rule : rules) {
                if (group.memberCount() >= rule.getMaxGroupSize()) {
                    continue;
                }

                CorrelationOutcome outcome;
                try {
                    outcome = rule.getEvaluator().evaluate(alert, group, rule);
                } catch (RuntimeException e) {
                    log.warn("Rule {} failed evaluating alert {} against group {}: {}",
                            rule.getName(), alert.getId(), group.getId(), e.getMessage());
                    statistics.recordEvaluationError(rule.getName());
                    continue;
                }

                if (outcome == null || !outcome.isMatched()) {
                    continue;
                }
                log.debug("Rule {} matched alert {} to group {} with score {}",
                        rule.getName(), alert.getId(), group.getId(), outcome.getScore());

                Match candidate = new Match(group, rule, outcome);
                if (best == null || candidate.beats(best)) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private GroupReference merge(Alert alert, Match match, Instant now) {
        AlertGroup group = match.group;
        RegisteredRule rule = match.rule;

        group.addMember(alert, rule.getName(), match.outcome.getScore(), match.outcome.getEvidence(), now);
        store.assign(alert.getId(), group.getId());
        statistics.recordCorrelated(match.outcome.getStrategy());

        GroupEventType event = GroupEventType.UPDATED;
        if (group.correlatedCount() > rule.getSuppressAfterCount()) {
            group.transitionTo(GroupStatus.SUPPRESSED, now);
            statistics.recordSuppressed();
            event = GroupEventType.SUPPRESSED;
            log.info("Group {} suppressed after {} correlated alerts (rule {})",
                    group.getId(), group.correlatedCount(), rule.getName());
        }

        log.debug("Merged alert {} into group {} via {} (score {})",
                alert.getId(), group.getId(), rule.getName(), match.outcome.getScore());

        publish(event, group);
        return GroupReference.of(group, GroupAction.MERGED, match.outcome.getStrategy());
    }

    private GroupReference createGroup(Alert alert, Instant now) {
        AlertGroup group = new AlertGroup(UUID.randomUUID().toString(), alert, now);
        store.add(group);
        statistics.recordGroupCreated();
        log.info("Created alert group {} with root alert {}", group.getId(), alert.getId());

        List<AlertGroup> evicted = store.evictOverflow(properties.getMaxGroups(), group.getId());
        if (!evicted.isEmpty()) {
            statistics.recordEvicted(evicted.size());
            for (AlertGroup victim : evicted) {
                log.info("Evicted group {} ({}, last updated {}) to stay within {} groups",
                        victim.getId(), victim.getStatus(), victim.getLastUpdated(), properties.getMaxGroups());
                submit("delete snapshot " + victim.getId(), () -> snapshotPersister.delete(victim.getId()));
            }
        }

        publish(GroupEventType.CREATED, group);
        return GroupReference.of(group, GroupAction.CREATED, null);
    }

    public Optional<AlertGroup> getGroup(String groupId) {
        lock.lock();
        try {
            return store.get(groupId).map(AlertGroup::copy);
        } finally {
            lock.unlock();
        }
    }

    public Optional<AlertGroup> getGroupForAlert(String alertId) {
        lock.lock();
        try {
            return store.findByAlert(alertId).map(AlertGroup::copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unresolved groups created within {@code maxAge}, newest first
     */
    public List<AlertGroup> getActiveGroups(Duration maxAge) {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(maxAge);
            return store.all().stream()
                    .filter(group -> group.getStatus() != GroupStatus.RESOLVED)
                    .filter(group -> !group.getCreatedAt().isBefore(cutoff))
                    .sorted(Comparator.comparing(AlertGroup::getCreatedAt).reversed())
                    .map(AlertGroup::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark a group resolved. Member ownership is kept until the group is garbage-collected.
     */
    public boolean resolveGroup(String groupId) {
        lock.lock();
        try {
            Optional<AlertGroup> found = store.get(groupId);
            if (found.isEmpty() || found.get().getStatus() == GroupStatus.RESOLVED) {
                return false;
            }
            AlertGroup group = found.get();
            group.transitionTo(GroupStatus.RESOLVED, clock.instant());
            log.info("Resolved alert group {} ({} members)", groupId, group.memberCount());

            publish(GroupEventType.RESOLVED, group);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve every open or suppressed group untouched for longer than {@code inactivityTimeout}
     *
     * @return ids of the groups resolved
     */
    public List<String> resolveInactive(Duration inactivityTimeout) {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<AlertGroup> idle = store.all().stream()
                    .filter(group -> group.getStatus() != GroupStatus.RESOLVED)
                    .filter(group -> Duration.between(group.getLastUpdated(), now).compareTo(inactivityTimeout) > 0)
                    .collect(Collectors.toList());

            for (AlertGroup group : idle) {
                Instant idleSince = group.getLastUpdated();
                group.transitionTo(GroupStatus.RESOLVED, now);
                log.info("Resolved inactive alert group {} (idle since {})", group.getId(), idleSince);
                publish(GroupEventType.RESOLVED, group);
            }
            return idle.stream().map(AlertGroup::getId).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public boolean reopenGroup(String groupId) {
        lock.lock();
        try {
            Optional<AlertGroup> found = store.get(groupId);
            if (found.isEmpty() || found.get().getStatus() == GroupStatus.OPEN) {
                return false;
            }
            AlertGroup group = found.get();
            GroupStatus previous = group.getStatus();
            group.reopen(clock.instant());
            log.info("Reopened alert group {} (was {})", groupId, previous);

            publish(GroupEventType.REOPENED, group);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void addRule(CorrelationRule rule) {
        ruleRegistry.register(rule);
    }

    public boolean removeRule(String name) {
        return ruleRegistry.remove(name);
    }

    public boolean enableRule(String name, boolean enabled) {
        return ruleRegistry.setEnabled(name, enabled);
    }

    public boolean addMaintenanceWindow(String ruleName, Instant start, Instant end) {
        return ruleRegistry.addMaintenanceWindow(ruleName, start, end);
    }

    public List<CorrelationRule> getRules() {
        return ruleRegistry.getRules();
    }

    public CorrelationRule requireRule(String name) {
        return ruleRegistry.find(name)
                .map(registered -> registered.getRule().copy())
                .orElseThrow(() -> new RuleNotFoundException(name));
    }

    public void registerListener(GroupEventListener listener) {
        eventDispatcher.register(listener);
    }

    public CorrelationStats getStats() {
        return statistics.snapshot(activeGroupCount(), ruleRegistry.enabledCount(), ruleRegistry.size());
    }

    public int activeGroupCount() {
        lock.lock();
        try {
            return (int) store.countActive();
        } finally {
            lock.unlock();
        }
    }

    public int groupCount() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every group matching the condition along with its alert ownership
     */
    List<AlertGroup> removeGroups(Predicate<AlertGroup> condition) {
        lock.lock();
        try {
            return store.removeIf(condition);
        } finally {
            lock.unlock();
        }
    }

    private void publish(GroupEventType event, AlertGroup group) {
        AlertGroup snapshot = group.copy();
        submit("persist group " + snapshot.getId(), () -> snapshotPersister.save(snapshot));
        submit(event + " event for group " + snapshot.getId(),
                () -> eventDispatcher.dispatch(event, snapshot));
    }

    private void submit(String description, Runnable task) {
        try {
            sideEffectExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Side-effect queue full, dropped task: {}", description);
            statistics.recordDroppedSideEffect();
        }
    }

    private static void validate(Alert alert) {
        if (alert == null) {
            throw new InvalidAlertException("Alert must not be null");
        }
        if (alert.getId() == null || alert.getId().isBlank()) {
            throw new InvalidAlertException("Alert id is required");
        }
        if (alert.getTriggeredAt() == null) {
            throw new InvalidAlertException("Alert " + alert.getId() + " has no triggeredAt");
        }
    }

    private static final class Match {
        private final AlertGroup group;
        private final RegisteredRule rule;
        private final CorrelationOutcome outcome;

        private Match(AlertGroup group, RegisteredRule rule, CorrelationOutcome outcome) {
            this.group = group;
            this.rule = rule;
            this.outcome = outcome;
        }

        // Higher score, then lower priority value, then earlier registration, then fresher group
        private boolean beats(Match other) {
            int byScore = Double.compare(outcome.getScore(), other.outcome.getScore());
            if (byScore != 0) return byScore > 0;

            int byPriority = Integer.compare(rule.getPriority(), other.rule.getPriority());
            if (byPriority != 0) return byPriority < 0;

            int bySequence = Long.compare(rule.getSequence(), other.rule.getSequence());
            if (bySequence != 0) return bySequence < 0;

            return group.getLastUpdated().isAfter(other.group.getLastUpdated());
        }
    }
}
