package com.company.correlation.domain;

import com.company.correlation.domain.enums.CorrelationStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time view of engine counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationStats {
    private long totalProcessed;
    private long totalCorrelated;
    private Map<CorrelationStrategy, Long> perStrategyCounts;
    private int activeGroups;
    private double avgProcessingLatencyMs;

    private long groupsCreated;
    private long suppressedGroups;
    private long rejectedAlerts;
    private long duplicateAlerts;
    private long evaluationErrors;
    private long persistenceFailures;
    private long callbackFailures;
    private long evictedGroups;
    private long droppedSideEffects;

    private int enabledRules;
    private int totalRules;

    // Percentage of processed alerts merged into an existing group
    private double successRate;
}
