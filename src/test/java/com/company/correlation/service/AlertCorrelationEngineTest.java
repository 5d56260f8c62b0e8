package com.company.correlation.service;

import com.company.correlation.cache.GroupSnapshotPersister;
import com.company.correlation.config.CorrelationProperties;
import com.company.correlation.correlation.evaluator.CorrelationEvaluator;
import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.correlation.rule.RuleRegistry;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.CorrelationRule;
import com.company.correlation.domain.CorrelationStats;
import com.company.correlation.domain.GroupReference;
import com.company.correlation.domain.enums.AlertCategory;
import com.company.correlation.domain.enums.AlertSeverity;
import com.company.correlation.domain.enums.AlertStatus;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.domain.enums.GroupAction;
import com.company.correlation.domain.enums.GroupStatus;
import com.company.correlation.event.GroupEventDispatcher;
import com.company.correlation.exception.InvalidAlertException;
import com.company.correlation.exception.RuleNotFoundException;
import com.company.correlation.support.MutableClock;
import com.company.correlation.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.company.correlation.support.TestFixtures.T0;
import static com.company.correlation.support.TestFixtures.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("AlertCorrelationEngine Tests")
class AlertCorrelationEngineTest {

    private MutableClock clock;
    private CorrelationProperties properties;
    private CorrelationStatistics statistics;
    private GroupSnapshotPersister persister;
    private List<String> events;
    private AlertCorrelationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new CorrelationProperties();
        persister = mock(GroupSnapshotPersister.class);
        buildEngine(TestFixtures.registry());
    }

    private void buildEngine(RuleRegistry registry) {
        statistics = new CorrelationStatistics(new SimpleMeterRegistry(), properties);
        GroupEventDispatcher dispatcher = new GroupEventDispatcher(statistics);
        engine = new AlertCorrelationEngine(registry, persister, dispatcher, statistics,
                properties, clock, Runnable::run);

        events = Collections.synchronizedList(new ArrayList<>());
        engine.registerListener((type, group) -> events.add(type + ":" + group.getId()));
    }

    private static CorrelationRule.CorrelationRuleBuilder spatialRule() {
        return CorrelationRule.builder()
                .name("shared-source")
                .strategy(CorrelationStrategy.SPATIAL)
                .hostWeight(2.5)
                .componentWeight(2.0)
                .categoryWeight(1.5);
    }

    private static Alert unrelated(String id) {
        return alert(id)
                .sourceHost("host-" + id)
                .sourceComponent("component-" + id)
                .category(AlertCategory.BUSINESS)
                .title("Unrelated " + id)
                .description("nothing in common")
                .build();
    }

    private GroupReference process(Alert alert) {
        return engine.process(alert).orElseThrow();
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("First alert opens a group with itself as root")
        void shouldCreateGroupForFirstAlert() {
            engine.addRule(spatialRule().build());

            GroupReference ref = process(alert("a1").build());

            assertThat(ref.getAction()).isEqualTo(GroupAction.CREATED);
            assertThat(ref.getMemberCount()).isEqualTo(1);
            assertThat(ref.getConfidenceScore()).isZero();
            assertThat(ref.getStrategy()).isNull();
            assertThat(events).containsExactly("CREATED:" + ref.getGroupId());
        }

        @Test
        @DisplayName("Alerts sharing host, component and category merge into one group")
        void shouldMergeSpatiallyRelatedAlerts() {
            engine.addRule(spatialRule().build());

            GroupReference first = process(alert("a1").build());
            GroupReference second = process(alert("a2").build());

            assertThat(second.getAction()).isEqualTo(GroupAction.MERGED);
            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(second.getStrategy()).isEqualTo(CorrelationStrategy.SPATIAL);
            assertThat(second.getConfidenceScore()).isCloseTo(6.0 / 7.0, within(1e-9));

            AlertGroup group = engine.getGroup(first.getGroupId()).orElseThrow();
            assertThat(group.getMemberIds()).containsExactly("a1", "a2");
            assertThat(group.getContributingRules()).containsExactly("shared-source");
            assertThat(group.getEvidence()).containsKey("shared-source");
            assertThat(events).containsExactly(
                    "CREATED:" + first.getGroupId(),
                    "UPDATED:" + first.getGroupId());
        }

        @Test
        @DisplayName("Identical text merges through semantic similarity")
        void shouldMergeIdenticalText() {
            engine.addRule(CorrelationRule.builder()
                    .name("similar-text")
                    .strategy(CorrelationStrategy.SEMANTIC)
                    .weight(0.8)
                    .build());

            GroupReference first = process(unrelated("a1").toBuilder().title("Disk full on /var").build());
            GroupReference second = process(unrelated("a2").toBuilder().title("Disk full on /var").build());

            assertThat(second.getAction()).isEqualTo(GroupAction.MERGED);
            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(second.getConfidenceScore()).isCloseTo(0.8, within(1e-9));
        }

        @Test
        @DisplayName("Alerts sharing a regex merge at the pattern confidence")
        void shouldMergeOnPattern() {
            engine.addRule(CorrelationRule.builder()
                    .name("timeouts")
                    .strategy(CorrelationStrategy.PATTERN_MATCH)
                    .patternRegex("(timeout|latency)")
                    .build());

            GroupReference first = process(unrelated("a1").toBuilder().title("Gateway timeout").build());
            GroupReference second = process(unrelated("a2").toBuilder().title("Latency spike").build());
            GroupReference third = process(unrelated("a3").toBuilder().title("Disk full").build());

            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(second.getConfidenceScore()).isCloseTo(0.8, within(1e-9));
            assertThat(third.getAction()).isEqualTo(GroupAction.CREATED);
        }

        @Test
        @DisplayName("Temporal match below HIGH confidence opens a new group")
        void shouldNotMergeWeakTemporalMatch() {
            engine.addRule(CorrelationRule.builder()
                    .name("temporal")
                    .strategy(CorrelationStrategy.TEMPORAL)
                    .timeWindow(Duration.ofMinutes(10))
                    .build());

            GroupReference first = process(unrelated("a1"));

            clock.advance(Duration.ofMinutes(1));
            GroupReference close = process(unrelated("a2").toBuilder().triggeredAt(T0.plus(Duration.ofMinutes(1))).build());

            clock.advance(Duration.ofMinutes(4));
            GroupReference weak = process(unrelated("a3").toBuilder().triggeredAt(T0.plus(Duration.ofMinutes(5))).build());

            // e^-0.1 merges, e^-0.5 (about 0.61) and e^-0.4 average to MEDIUM only
            assertThat(close.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(weak.getAction()).isEqualTo(GroupAction.CREATED);
        }

        @Test
        @DisplayName("Alert arriving after the window opens a new group")
        void shouldNotMergeOutsideTemporalWindow() {
            engine.addRule(CorrelationRule.builder()
                    .name("temporal")
                    .strategy(CorrelationStrategy.TEMPORAL)
                    .timeWindow(Duration.ofMinutes(10))
                    .build());

            GroupReference first = process(unrelated("a1"));
            clock.advance(Duration.ofMinutes(20));
            GroupReference later = process(unrelated("a2").toBuilder().triggeredAt(T0.plus(Duration.ofMinutes(20))).build());

            assertThat(later.getAction()).isEqualTo(GroupAction.CREATED);
            assertThat(later.getGroupId()).isNotEqualTo(first.getGroupId());
        }

        @Test
        @DisplayName("Every alert is owned by exactly one group")
        void shouldKeepOwnershipExclusive() {
            engine.addRule(spatialRule().build());

            for (int i = 0; i < 5; i++) {
                process(alert("related-" + i).build());
                process(unrelated("other-" + i));
            }

            List<AlertGroup> groups = engine.getActiveGroups(Duration.ofDays(1));
            long memberships = groups.stream().mapToLong(AlertGroup::memberCount).sum();
            long distinct = groups.stream().flatMap(g -> g.getMemberIds().stream()).distinct().count();

            assertThat(memberships).isEqualTo(10);
            assertThat(distinct).isEqualTo(10);
            assertThat(engine.getGroupForAlert("related-4").orElseThrow().memberCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("Highest score wins and equal scores go to the lower priority value")
        void shouldPreferLowerPriorityOnTies() {
            engine.addRule(CorrelationRule.builder()
                    .name("pattern-late").strategy(CorrelationStrategy.PATTERN_MATCH)
                    .patternRegex("timeout").priority(50).build());
            engine.addRule(CorrelationRule.builder()
                    .name("pattern-early").strategy(CorrelationStrategy.PATTERN_MATCH)
                    .patternRegex("timeout").priority(10).build());

            GroupReference first = process(unrelated("a1").toBuilder().title("Read timeout").build());
            process(unrelated("a2").toBuilder().title("Write timeout").build());

            assertThat(engine.getGroup(first.getGroupId()).orElseThrow().getContributingRules())
                    .containsExactly("pattern-early");
        }

        @Test
        @DisplayName("Groups at the rule's maximum size take no more members from it")
        void shouldRespectMaxGroupSize() {
            engine.addRule(spatialRule().maxGroupSize(2).build());

            GroupReference first = process(alert("a1").build());
            process(alert("a2").build());
            GroupReference third = process(alert("a3").build());

            assertThat(third.getGroupId()).isNotEqualTo(first.getGroupId());
            assertThat(engine.getGroup(first.getGroupId()).orElseThrow().memberCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputHandling {

        @Test
        @DisplayName("Processing the same alert twice returns the existing group unchanged")
        void shouldBeIdempotent() {
            engine.addRule(spatialRule().build());
            GroupReference first = process(alert("a1").build());

            GroupReference again = process(alert("a1").build());

            assertThat(again.getAction()).isEqualTo(GroupAction.EXISTING);
            assertThat(again.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(again.getMemberCount()).isEqualTo(1);
            assertThat(engine.getStats().getDuplicateAlerts()).isEqualTo(1);
            assertThat(engine.getStats().getGroupsCreated()).isEqualTo(1);
        }

        @Test
        @DisplayName("Resolved and synthetic alerts are rejected")
        void shouldRejectResolvedAndSyntheticAlerts() {
            assertThat(engine.process(alert("r").status(AlertStatus.RESOLVED).build())).isEmpty();
            assertThat(engine.process(alert("t").tag("test", "true").build())).isEmpty();

            assertThat(engine.getStats().getRejectedAlerts()).isEqualTo(2);
            assertThat(engine.groupCount()).isZero();
        }

        @Test
        @DisplayName("A rejected alert that is already owned reports its group")
        void shouldReturnOwnerForRejectedKnownAlert() {
            GroupReference created = process(alert("a1").build());

            GroupReference ref = engine.process(alert("a1").status(AlertStatus.RESOLVED).build()).orElseThrow();

            assertThat(ref.getAction()).isEqualTo(GroupAction.EXISTING);
            assertThat(ref.getGroupId()).isEqualTo(created.getGroupId());
        }

        @Test
        @DisplayName("Structurally invalid alerts throw")
        void shouldRejectInvalidAlerts() {
            assertThatThrownBy(() -> engine.process(null)).isInstanceOf(InvalidAlertException.class);
            assertThatThrownBy(() -> engine.process(alert(" ").build())).isInstanceOf(InvalidAlertException.class);
            assertThatThrownBy(() -> engine.process(alert("x").triggeredAt(null).build()))
                    .isInstanceOf(InvalidAlertException.class);
        }

        @Test
        @DisplayName("A failing evaluator counts as a non-match and other rules still run")
        void shouldIsolateEvaluatorFailures() {
            List<CorrelationEvaluator> evaluators = TestFixtures.evaluators();
            evaluators.removeIf(e -> e.strategy() == CorrelationStrategy.TEMPORAL);
            evaluators.add(new CorrelationEvaluator() {
                @Override
                public CorrelationStrategy strategy() {
                    return CorrelationStrategy.TEMPORAL;
                }

                @Override
                public CorrelationOutcome evaluate(
                        Alert alert, AlertGroup group, RegisteredRule rule) {
                    throw new IllegalStateException("boom");
                }
            });
            buildEngine(new RuleRegistry(evaluators, TestFixtures.validator()));
            engine.addRule(CorrelationRule.builder().name("broken").strategy(CorrelationStrategy.TEMPORAL)
                    .priority(1).build());
            engine.addRule(spatialRule().build());

            GroupReference first = process(alert("a1").build());
            GroupReference second = process(alert("a2").build());

            assertThat(second.getGroupId()).isEqualTo(first.getGroupId());
            assertThat(engine.getStats().getEvaluationErrors()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Rule filters")
    class RuleFilters {

        @Test
        @DisplayName("Rules inside a maintenance window are not applied")
        void shouldSkipRulesDuringMaintenance() {
            engine.addRule(spatialRule().build());
            assertThat(engine.addMaintenanceWindow("shared-source", T0.minusSeconds(60), T0.plusSeconds(60)))
                    .isTrue();

            GroupReference first = process(alert("a1").build());
            GroupReference second = process(alert("a2").build());

            assertThat(second.getGroupId()).isNotEqualTo(first.getGroupId());
        }

        @Test
        @DisplayName("Severity filter limits which alerts a rule sees")
        void shouldApplySeverityFilter() {
            engine.addRule(spatialRule().severityFilter(EnumSet.of(AlertSeverity.CRITICAL)).build());

            GroupReference first = process(alert("a1").build());
            GroupReference second = process(alert("a2").build());
            GroupReference critical = process(alert("c1").severity(AlertSeverity.CRITICAL).build());

            assertThat(second.getGroupId()).isNotEqualTo(first.getGroupId());
            assertThat(critical.getAction()).isEqualTo(GroupAction.MERGED);
        }

        @Test
        @DisplayName("Disabled rules are not applied")
        void shouldSkipDisabledRules() {
            engine.addRule(spatialRule().build());
            assertThat(engine.enableRule("shared-source", false)).isTrue();

            GroupReference first = process(alert("a1").build());
            GroupReference second = process(alert("a2").build());

            assertThat(second.getGroupId()).isNotEqualTo(first.getGroupId());
            assertThat(engine.getStats().getEnabledRules()).isZero();
            assertThat(engine.getStats().getTotalRules()).isEqualTo(1);
        }

        @Test
        @DisplayName("requireRule throws for unknown names, boolean operations return false")
        void shouldReportUnknownRules() {
            assertThatThrownBy(() -> engine.requireRule("missing")).isInstanceOf(RuleNotFoundException.class);
            assertThat(engine.removeRule("missing")).isFalse();
            assertThat(engine.enableRule("missing", true)).isFalse();
            assertThat(engine.addMaintenanceWindow("missing", T0, T0)).isFalse();

            engine.addRule(spatialRule().build());
            assertThat(engine.requireRule("shared-source").getStrategy()).isEqualTo(CorrelationStrategy.SPATIAL);
            assertThat(engine.getRules()).hasSize(1);
            assertThat(engine.removeRule("shared-source")).isTrue();
        }
    }

    @Nested
    @DisplayName("Suppression")
    class Suppression {

        @Test
        @DisplayName("Group is suppressed once correlated members exceed the threshold")
        void shouldSuppressAfterThreshold() {
            engine.addRule(spatialRule().suppressAfterCount(8).build());
            GroupReference root = process(alert("root").build());

            for (int i = 1; i <= 8; i++) {
                process(alert("m" + i).build());
            }
            assertThat(engine.getGroup(root.getGroupId()).orElseThrow().getStatus()).isEqualTo(GroupStatus.OPEN);

            GroupReference ninth = process(alert("m9").build());

            assertThat(ninth.getStatus()).isEqualTo(GroupStatus.SUPPRESSED);
            assertThat(events).contains("SUPPRESSED:" + root.getGroupId());
            assertThat(engine.getStats().getSuppressedGroups()).isEqualTo(1);
        }

        @Test
        @DisplayName("Alerts arriving after suppression open a new group")
        void shouldNotMergeIntoSuppressedGroup() {
            engine.addRule(spatialRule().suppressAfterCount(1).build());
            GroupReference root = process(alert("root").build());
            process(alert("m1").build());
            GroupReference suppressing = process(alert("m2").build());
            assertThat(suppressing.getStatus()).isEqualTo(GroupStatus.SUPPRESSED);

            GroupReference later = process(alert("m3").build());

            assertThat(later.getAction()).isEqualTo(GroupAction.CREATED);
            assertThat(later.getGroupId()).isNotEqualTo(root.getGroupId());
            assertThat(later.getStatus()).isEqualTo(GroupStatus.OPEN);
            assertThat(engine.getGroup(root.getGroupId()).orElseThrow().getMemberIds())
                    .containsExactly("root", "m1", "m2");
            assertThat(events).endsWith("SUPPRESSED:" + root.getGroupId(), "CREATED:" + later.getGroupId());
        }
    }

    @Nested
    @DisplayName("Lifecycle operations")
    class LifecycleOperations {

        @Test
        @DisplayName("Resolve closes the group but keeps ownership until cleanup")
        void shouldResolveAndKeepOwnership() {
            engine.addRule(spatialRule().build());
            GroupReference first = process(alert("a1").build());

            assertThat(engine.resolveGroup(first.getGroupId())).isTrue();
            assertThat(engine.resolveGroup(first.getGroupId())).isFalse();
            assertThat(engine.resolveGroup("unknown")).isFalse();

            assertThat(process(alert("a1").build()).getAction()).isEqualTo(GroupAction.EXISTING);

            GroupReference related = process(alert("a2").build());
            assertThat(related.getAction()).isEqualTo(GroupAction.CREATED);
            assertThat(events).contains("RESOLVED:" + first.getGroupId());
        }

        @Test
        @DisplayName("Reopen moves a resolved group back to OPEN")
        void shouldReopenResolvedGroup() {
            GroupReference first = process(alert("a1").build());

            assertThat(engine.reopenGroup(first.getGroupId())).isFalse();
            engine.resolveGroup(first.getGroupId());
            assertThat(engine.reopenGroup(first.getGroupId())).isTrue();

            assertThat(engine.getGroup(first.getGroupId()).orElseThrow().getStatus()).isEqualTo(GroupStatus.OPEN);
            assertThat(events).endsWith("REOPENED:" + first.getGroupId());
        }

        @Test
        @DisplayName("Returned groups are snapshots")
        void shouldReturnDetachedGroups() {
            GroupReference first = process(alert("a1").build());
            AlertGroup snapshot = engine.getGroup(first.getGroupId()).orElseThrow();

            snapshot.addMember(alert("intruder").build(), "r", 1.0, null, T0);

            assertThat(engine.getGroup(first.getGroupId()).orElseThrow().memberCount()).isEqualTo(1);
            assertThat(engine.getGroupForAlert("intruder")).isEmpty();
        }

        @Test
        @DisplayName("Active groups are unresolved, within age and newest first")
        void shouldListActiveGroupsNewestFirst() {
            GroupReference oldest = process(unrelated("a1"));
            clock.advance(Duration.ofMinutes(30));
            GroupReference middle = process(unrelated("a2"));
            clock.advance(Duration.ofMinutes(30));
            GroupReference newest = process(unrelated("a3"));
            engine.resolveGroup(middle.getGroupId());

            assertThat(engine.getActiveGroups(Duration.ofHours(2)))
                    .extracting(AlertGroup::getId)
                    .containsExactly(newest.getGroupId(), oldest.getGroupId());
            assertThat(engine.getActiveGroups(Duration.ofMinutes(45)))
                    .extracting(AlertGroup::getId)
                    .containsExactly(newest.getGroupId());
        }

        @Test
        @DisplayName("Beyond the group cap resolved groups are evicted before open ones")
        void shouldEvictResolvedGroupsFirst() {
            properties.setMaxGroups(2);
            buildEngine(TestFixtures.registry());

            GroupReference first = process(unrelated("a1"));
            clock.advance(Duration.ofSeconds(1));
            GroupReference second = process(unrelated("a2"));
            engine.resolveGroup(second.getGroupId());
            clock.advance(Duration.ofSeconds(1));
            GroupReference third = process(unrelated("a3"));

            assertThat(engine.groupCount()).isEqualTo(2);
            assertThat(engine.getGroup(second.getGroupId())).isEmpty();
            assertThat(engine.getGroup(first.getGroupId())).isPresent();
            assertThat(engine.getGroup(third.getGroupId())).isPresent();
            assertThat(engine.getGroupForAlert("a2")).isEmpty();
            assertThat(engine.getStats().getEvictedGroups()).isEqualTo(1);
            verify(persister).delete(second.getGroupId());
        }

        @Test
        @DisplayName("Every state change is persisted")
        void shouldPersistSnapshots() {
            GroupReference first = process(alert("a1").build());
            engine.resolveGroup(first.getGroupId());

            verify(persister, atLeastOnce()).save(any(AlertGroup.class));
        }
    }

    @Test
    @DisplayName("Concurrent producers leave every alert owned by exactly one group")
    void shouldKeepOwnershipExclusiveUnderConcurrency() throws Exception {
        engine.addRule(spatialRule().build());
        int threads = 8;
        int alertsPerThread = 200;
        int distinctIds = 300;

        Set<String> submitted = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService producers = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                int offset = t * 37;
                futures.add(producers.submit(() -> {
                    start.await();
                    for (int i = 0; i < alertsPerThread; i++) {
                        int n = (offset + i) % distinctIds;
                        String id = "alert-" + n;
                        submitted.add(id);
                        engine.process(n % 3 == 0 ? unrelated(id) : alert(id).build());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            producers.shutdownNow();
        }

        List<AlertGroup> groups = engine.getActiveGroups(Duration.ofDays(1));
        long memberships = groups.stream().mapToLong(AlertGroup::memberCount).sum();
        long distinctMembers = groups.stream().flatMap(g -> g.getMemberIds().stream()).distinct().count();

        assertThat(submitted).hasSize(distinctIds);
        assertThat(memberships).isEqualTo(submitted.size());
        assertThat(distinctMembers).isEqualTo(submitted.size());
        for (String id : submitted) {
            assertThat(engine.getGroupForAlert(id))
                    .as("owner of %s", id)
                    .hasValueSatisfying(group -> assertThat(group.getMemberIds()).contains(id));
        }

        CorrelationStats stats = engine.getStats();
        assertThat(stats.getTotalProcessed()).isEqualTo((long) threads * alertsPerThread);
        assertThat(stats.getGroupsCreated() + stats.getTotalCorrelated()).isEqualTo(submitted.size());
        assertThat(stats.getDuplicateAlerts()).isEqualTo((long) threads * alertsPerThread - submitted.size());
    }

    @Test
    @DisplayName("Side effects rejected by a saturated executor are dropped and counted")
    void shouldCountDroppedSideEffects() {
        CorrelationStatistics saturatedStats = new CorrelationStatistics(new SimpleMeterRegistry(), properties);
        AlertCorrelationEngine saturated = new AlertCorrelationEngine(TestFixtures.registry(), persister,
                new GroupEventDispatcher(saturatedStats), saturatedStats, properties, clock,
                task -> {
                    throw new RejectedExecutionException("queue full");
                });

        GroupReference ref = saturated.process(alert("a1").build()).orElseThrow();

        assertThat(ref.getAction()).isEqualTo(GroupAction.CREATED);
        assertThat(saturated.getStats().getDroppedSideEffects()).isEqualTo(2);
        verifyNoInteractions(persister);
    }

    @Test
    @DisplayName("Stats reflect processed, correlated and per-strategy counts")
    void shouldReportStats() {
        engine.addRule(spatialRule().build());

        process(alert("a1").build());
        process(alert("a2").build());
        process(unrelated("b1"));
        process(alert("a3").build());

        CorrelationStats stats = engine.getStats();

        assertThat(stats.getTotalProcessed()).isEqualTo(4);
        assertThat(stats.getTotalCorrelated()).isEqualTo(2);
        assertThat(stats.getGroupsCreated()).isEqualTo(2);
        assertThat(stats.getActiveGroups()).isEqualTo(2);
        assertThat(stats.getPerStrategyCounts()).containsEntry(CorrelationStrategy.SPATIAL, 2L);
        assertThat(stats.getSuccessRate()).isEqualTo(50.0);
        assertThat(stats.getAvgProcessingLatencyMs()).isGreaterThanOrEqualTo(0.0);
    }
}
