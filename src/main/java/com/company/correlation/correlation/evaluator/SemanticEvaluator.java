package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import com.company.correlation.util.SimilarityUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Title and description text similarity
 */
@Component
public class SemanticEvaluator implements CorrelationEvaluator {

    private static final double TITLE_WEIGHT = 0.6;
    private static final double DESCRIPTION_WEIGHT = 0.4;

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.SEMANTIC;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        List<Alert> members = group.getMembers();

        double total = 0.0;
        double best = 0.0;
        int similarMembers = 0;

        for (Alert member : members) {
            double combined = similarity(alert, member);
            total += combined;
            best = Math.max(best, combined);
            if (combined >= rule.getMinSimilarityScore()) {
                similarMembers++;
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("bestSimilarity", ScoringUtils.round(best, 4));
        evidence.put("similarMembers", similarMembers);
        evidence.put("threshold", rule.getMinSimilarityScore());

        if (similarMembers == 0) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }

        double average = total / members.size();
        evidence.put("averageSimilarity", ScoringUtils.round(average, 4));

        return CorrelationOutcome.matched(strategy(), ScoringUtils.cap(rule.getWeight() * average), evidence);
    }

    /**
     * Symmetric in its arguments; identical non-blank alerts score 1.0
     */
    public static double similarity(Alert a, Alert b) {
        double title = SimilarityUtils.textSimilarity(a.getTitle(), b.getTitle());
        double description = SimilarityUtils.textSimilarity(a.getDescription(), b.getDescription());
        return title * TITLE_WEIGHT + description * DESCRIPTION_WEIGHT;
    }
}
