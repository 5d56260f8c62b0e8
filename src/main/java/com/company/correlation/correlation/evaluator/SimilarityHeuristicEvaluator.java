package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.AlertCategory;
import com.company.correlation.domain.enums.AlertSeverity;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import com.company.correlation.util.SimilarityUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed keyword and attribute feature vectors compared slot by slot.
 * Agreement is the fraction of slots that differ by less than 0.1; the best member counts.
 */
@Component
public class SimilarityHeuristicEvaluator implements CorrelationEvaluator {

    static final List<String> KEYWORDS = List.of(
            "error", "warning", "critical", "timeout", "connection",
            "database", "memory", "cpu", "disk");

    static final int FEATURE_COUNT = 1 + KEYWORDS.size() + 4;

    private static final double SLOT_TOLERANCE = 0.1;

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.SIMILARITY_HEURISTIC;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        double[] alertFeatures = features(alert);

        double best = 0.0;
        String bestMember = null;
        for (Alert member : group.getMembers()) {
            double agreement = agreement(alertFeatures, features(member));
            if (agreement > best) {
                best = agreement;
                bestMember = member.getId();
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("agreement", ScoringUtils.round(best, 4));
        evidence.put("threshold", rule.getSimilarityThreshold());
        if (bestMember != null) {
            evidence.put("closestMember", bestMember);
        }

        if (best < rule.getSimilarityThreshold()) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }
        return CorrelationOutcome.matched(strategy(), ScoringUtils.cap(rule.getWeight() * best), evidence);
    }

    static double[] features(Alert alert) {
        String text = alert.getText().toLowerCase(Locale.ROOT);
        double[] features = new double[FEATURE_COUNT];

        int slot = 0;
        features[slot++] = SimilarityUtils.wordCount(text);
        for (String keyword : KEYWORDS) {
            features[slot++] = SimilarityUtils.countOccurrences(text, keyword);
        }
        features[slot++] = alert.getSeverity() == AlertSeverity.CRITICAL ? 1 : 0;
        features[slot++] = alert.getSeverity() == AlertSeverity.HIGH ? 1 : 0;
        features[slot++] = alert.getCategory() == AlertCategory.PERFORMANCE ? 1 : 0;
        features[slot] = alert.getCategory() == AlertCategory.AVAILABILITY ? 1 : 0;
        return features;
    }

    static double agreement(double[] a, double[] b) {
        int agreeing = 0;
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) < SLOT_TOLERANCE) agreeing++;
        }
        return (double) agreeing / a.length;
    }
}
