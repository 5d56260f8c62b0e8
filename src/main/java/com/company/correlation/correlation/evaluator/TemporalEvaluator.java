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
 * Exponential time-decay proximity between the alert and each group member inside the window
 */
@Component
public class TemporalEvaluator implements CorrelationEvaluator {

    private static final double MIN_MEMBER_SCORE = 0.1;

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.TEMPORAL;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        Duration window = rule.getTimeWindow();

        double total = 0.0;
        int inWindow = 0;
        boolean anyAboveFloor = false;
        double closestSeconds = Double.MAX_VALUE;

        for (Alert member : group.getMembers()) {
            if (member.getTriggeredAt() == null) continue;

            Duration delta = ScoringUtils.distance(alert.getTriggeredAt(), member.getTriggeredAt());
            if (delta.compareTo(window) > 0) continue;

            double memberScore = ScoringUtils.temporalDecay(delta, window);
            total += memberScore;
            inWindow++;
            anyAboveFloor |= memberScore > MIN_MEMBER_SCORE;
            closestSeconds = Math.min(closestSeconds, ScoringUtils.toSeconds(delta));
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("windowSeconds", ScoringUtils.toSeconds(window));
        evidence.put("membersInWindow", inWindow);

        if (inWindow == 0 || !anyAboveFloor) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }

        double average = total / inWindow;
        evidence.put("averageDecay", ScoringUtils.round(average, 4));
        evidence.put("closestSeconds", closestSeconds);

        return CorrelationOutcome.matched(strategy(), ScoringUtils.cap(rule.getWeight() * average), evidence);
    }
}
