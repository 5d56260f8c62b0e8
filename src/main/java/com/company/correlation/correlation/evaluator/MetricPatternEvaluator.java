package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relative closeness of metric readings the alert shares with group members
 */
@Component
public class MetricPatternEvaluator implements CorrelationEvaluator {

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.METRIC_PATTERN;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        if (alert.getMetricValues().isEmpty()) {
            return CorrelationOutcome.noMatch(strategy(), Map.of("reason", "alert has no metric values"));
        }

        double threshold = rule.getMetricCorrelationThreshold();
        double total = 0.0;
        int correlated = 0;
        double best = 0.0;

        for (Alert member : group.getMembers()) {
            if (member.getMetricValues().isEmpty()) continue;

            double value = ScoringUtils.metricSimilarity(alert.getMetricValues(), member.getMetricValues());
            best = Math.max(best, value);
            if (value >= threshold) {
                total += value;
                correlated++;
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("correlatedMembers", correlated);
        evidence.put("bestCorrelation", ScoringUtils.round(best, 4));
        evidence.put("threshold", threshold);

        if (correlated == 0) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }

        double average = total / correlated;
        evidence.put("averageCorrelation", ScoringUtils.round(average, 4));

        return CorrelationOutcome.matched(strategy(), ScoringUtils.cap(rule.getWeight() * average), evidence);
    }
}
