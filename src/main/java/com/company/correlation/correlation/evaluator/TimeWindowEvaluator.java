package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coarse fallback: how soon after the group was opened did the alert fire
 */
@Component
public class TimeWindowEvaluator implements CorrelationEvaluator {

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.TIME_WINDOW;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        Duration window = rule.getTimeWindow();
        Duration delta = ScoringUtils.distance(alert.getTriggeredAt(), group.getCreatedAt());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("secondsSinceGroupCreated", ScoringUtils.toSeconds(delta));
        evidence.put("windowSeconds", ScoringUtils.toSeconds(window));

        if (delta.compareTo(window) > 0) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }

        double proximity = 1.0 - ScoringUtils.toSeconds(delta) / ScoringUtils.toSeconds(window);
        return CorrelationOutcome.matched(strategy(), ScoringUtils.cap(rule.getWeight() * proximity), evidence);
    }
}
