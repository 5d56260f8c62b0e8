package com.company.correlation.service;

import com.company.correlation.config.CorrelationProperties;
import com.company.correlation.domain.CorrelationStats;
import com.company.correlation.domain.enums.CorrelationStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters mirrored to Micrometer.
 * Average latency is taken over a bounded window of the most recent samples.
 */
@Component
public class CorrelationStatistics {

    private final MeterRegistry meterRegistry;
    private final int latencyWindowSize;
    private final Timer processLatency;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong correlated = new AtomicLong();
    private final AtomicLong groupsCreated = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong evaluationErrors = new AtomicLong();
    private final AtomicLong persistenceFailures = new AtomicLong();
    private final AtomicLong callbackFailures = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong droppedSideEffects = new AtomicLong();
    private final Map<CorrelationStrategy, AtomicLong> perStrategy = new ConcurrentHashMap<>();

    private final Deque<Double> latencies = new ArrayDeque<>();
    private double latencySum;

    public CorrelationStatistics(MeterRegistry meterRegistry, CorrelationProperties properties) {
        this.meterRegistry = meterRegistry;
        this.latencyWindowSize = Math.max(1, properties.getLatencyWindowSize());
        this.processLatency = Timer.builder("correlation.process.latency")
                .description("Time spent correlating a single alert")
                .register(meterRegistry);
    }

    public void recordProcessed(long elapsedNanos) {
        processed.incrementAndGet();
        meterRegistry.counter("correlation.alerts.processed").increment();
        processLatency.record(elapsedNanos, TimeUnit.NANOSECONDS);

        double millis = elapsedNanos / 1_000_000.0;
        synchronized (latencies) {
            latencies.addLast(millis);
            latencySum += millis;
            if (latencies.size() > latencyWindowSize) {
                latencySum -= latencies.removeFirst();
            }
        }
    }

    public void recordCorrelated(CorrelationStrategy strategy) {
        correlated.incrementAndGet();
        perStrategy.computeIfAbsent(strategy, s -> new AtomicLong()).incrementAndGet();
        meterRegistry.counter("correlation.alerts.correlated", "strategy", strategy.getTagValue()).increment();
    }

    public void recordGroupCreated() {
        groupsCreated.incrementAndGet();
        meterRegistry.counter("correlation.groups.created").increment();
    }

    public void recordSuppressed() {
        suppressed.incrementAndGet();
        meterRegistry.counter("correlation.groups.suppressed").increment();
    }

    public void recordRejected() {
        rejected.incrementAndGet();
    }

    public void recordDuplicate() {
        duplicates.incrementAndGet();
    }

    public void recordEvaluationError(String ruleName) {
        evaluationErrors.incrementAndGet();
        meterRegistry.counter("correlation.evaluation.errors", "rule", ruleName).increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.incrementAndGet();
        meterRegistry.counter("correlation.persistence.failures").increment();
    }

    public void recordCallbackFailure() {
        callbackFailures.incrementAndGet();
        meterRegistry.counter("correlation.callback.failures").increment();
    }

    public void recordDroppedSideEffect() {
        droppedSideEffects.incrementAndGet();
        meterRegistry.counter("correlation.side_effects.dropped").increment();
    }

    public void recordEvicted(int count) {
        evicted.addAndGet(count);
    }

    public double averageLatencyMs() {
        synchronized (latencies) {
            return latencies.isEmpty() ? 0.0 : latencySum / latencies.size();
        }
    }

    public int latencySampleCount() {
        synchronized (latencies) {
            return latencies.size();
        }
    }

    public CorrelationStats snapshot(int activeGroups, int enabledRules, int totalRules) {
        Map<CorrelationStrategy, Long> strategies = new EnumMap<>(CorrelationStrategy.class);
        perStrategy.forEach((strategy, count) -> strategies.put(strategy, count.get()));

        long totalProcessed = processed.get();
        long totalCorrelated = correlated.get();

        return CorrelationStats.builder()
                .totalProcessed(totalProcessed)
                .totalCorrelated(totalCorrelated)
                .perStrategyCounts(strategies)
                .activeGroups(activeGroups)
                .avgProcessingLatencyMs(averageLatencyMs())
                .groupsCreated(groupsCreated.get())
                .suppressedGroups(suppressed.get())
                .rejectedAlerts(rejected.get())
                .duplicateAlerts(duplicates.get())
                .evaluationErrors(evaluationErrors.get())
                .persistenceFailures(persistenceFailures.get())
                .callbackFailures(callbackFailures.get())
                .evictedGroups(evicted.get())
                .droppedSideEffects(droppedSideEffects.get())
                .enabledRules(enabledRules)
                .totalRules(totalRules)
                .successRate(totalProcessed == 0 ? 0.0 : totalCorrelated * 100.0 / totalProcessed)
                .build();
    }
}
