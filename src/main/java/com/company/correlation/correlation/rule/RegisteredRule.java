package com.company.correlation.correlation.rule;

import com.company.correlation.correlation.evaluator.CorrelationEvaluator;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.CorrelationRule;
import com.company.correlation.domain.MaintenanceWindow;
import com.company.correlation.domain.enums.CorrelationStrategy;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A validated rule as held by the registry, with its evaluator and compiled pattern resolved
 * once at registration. Immutable: changes produce a new instance with the same sequence.
 */
@Getter
public class RegisteredRule {

    private final CorrelationRule rule;
    private final CorrelationEvaluator evaluator;
    private final Pattern pattern;
    private final long sequence;

    RegisteredRule(CorrelationRule rule, CorrelationEvaluator evaluator, Pattern pattern, long sequence) {
        this.rule = rule;
        this.evaluator = evaluator;
        this.pattern = pattern;
        this.sequence = sequence;
    }

    RegisteredRule withEnabled(boolean enabled) {
        CorrelationRule updated = rule.copy();
        updated.setEnabled(enabled);
        return new RegisteredRule(updated, evaluator, pattern, sequence);
    }

    RegisteredRule withMaintenanceWindow(MaintenanceWindow window) {
        CorrelationRule updated = rule.copy();
        updated.getMaintenanceWindows().add(window);
        return new RegisteredRule(updated, evaluator, pattern, sequence);
    }

    /**
     * Enabled, outside every maintenance window, and passing the severity, category and tag filters
     */
    public boolean appliesTo(Alert alert) {
        if (!rule.isEnabled()) return false;
        if (inMaintenance(alert.getTriggeredAt())) return false;

        if (!rule.getSeverityFilter().isEmpty() && !rule.getSeverityFilter().contains(alert.getSeverity())) {
            return false;
        }
        if (!rule.getCategoryFilter().isEmpty() && !rule.getCategoryFilter().contains(alert.getCategory())) {
            return false;
        }
        for (Map.Entry<String, String> filter : rule.getTagFilters().entrySet()) {
            if (!filter.getValue().equals(alert.getTags().get(filter.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public boolean inMaintenance(Instant instant) {
        return rule.getMaintenanceWindows().stream().anyMatch(window -> window.contains(instant));
    }

    public String getName() {
        return rule.getName();
    }

    public CorrelationStrategy getStrategy() {
        return rule.getStrategy();
    }

    public boolean isEnabled() {
        return rule.isEnabled();
    }

    public int getPriority() {
        return rule.getPriority();
    }

    public double getWeight() {
        return rule.getWeight();
    }

    public Duration getTimeWindow() {
        return rule.getTimeWindow();
    }

    public double getHostWeight() {
        return rule.getHostWeight();
    }

    public double getComponentWeight() {
        return rule.getComponentWeight();
    }

    public double getCategoryWeight() {
        return rule.getCategoryWeight();
    }

    public double getMinSimilarityScore() {
        return rule.getMinSimilarityScore();
    }

    public double getMetricCorrelationThreshold() {
        return rule.getMetricCorrelationThreshold();
    }

    public double getPatternConfidence() {
        return rule.getPatternConfidence();
    }

    public double getSimilarityThreshold() {
        return rule.getSimilarityThreshold();
    }

    public int getSuppressAfterCount() {
        return rule.getSuppressAfterCount();
    }

    public int getMaxGroupSize() {
        return rule.getMaxGroupSize();
    }

    @Override
    public String toString() {
        return "RegisteredRule(" + rule.getName() + ", " + rule.getStrategy()
                + ", priority=" + rule.getPriority() + ", enabled=" + rule.isEnabled() + ")";
    }
}
