package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import com.company.correlation.util.SimilarityUtils;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared source attributes: host, component, category and tag keys.
 * <p>
 * The score averages match values over the matching members only, not over the whole group, so
 * a single identical member scores {@code weight * (host + component + category) / maxPossible}
 * regardless of how many unrelated members the group holds.
 */
@Component
public class SpatialEvaluator implements CorrelationEvaluator {

    private static final double TAG_OVERLAP_WEIGHT = 1.0;

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.SPATIAL;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        double maxPossible = rule.getHostWeight() + rule.getComponentWeight()
                + rule.getCategoryWeight() + TAG_OVERLAP_WEIGHT;

        double total = 0.0;
        int matching = 0;
        int sameHost = 0;
        int sameComponent = 0;
        int sameCategory = 0;
        Set<String> commonTags = new TreeSet<>();

        for (Alert member : group.getMembers()) {
            double value = 0.0;

            if (sameNonBlank(alert.getSourceHost(), member.getSourceHost())) {
                value += rule.getHostWeight();
                sameHost++;
            }
            if (sameNonBlank(alert.getSourceComponent(), member.getSourceComponent())) {
                value += rule.getComponentWeight();
                sameComponent++;
            }
            if (alert.getCategory() != null && alert.getCategory() == member.getCategory()) {
                value += rule.getCategoryWeight();
                sameCategory++;
            }

            Set<String> shared = sharedTagKeys(alert.getTags(), member.getTags());
            if (!shared.isEmpty()) {
                double overlap = (double) shared.size()
                        / Math.max(alert.getTags().size(), member.getTags().size());
                value += Math.min(overlap, 1.0);
                commonTags.addAll(shared);
            }

            if (value > 0) {
                total += value;
                matching++;
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("matchingMembers", matching);
        evidence.put("sameHost", sameHost);
        evidence.put("sameComponent", sameComponent);
        evidence.put("sameCategory", sameCategory);
        evidence.put("commonTags", commonTags);
        evidence.put("maxPossible", maxPossible);

        if (matching == 0 || maxPossible <= 0) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }

        double average = total / matching;
        evidence.put("averageMatch", ScoringUtils.round(average, 4));

        return CorrelationOutcome.matched(strategy(),
                ScoringUtils.cap(rule.getWeight() * average / maxPossible), evidence);
    }

    private static boolean sameNonBlank(String a, String b) {
        return !SimilarityUtils.isBlank(a) && !SimilarityUtils.isBlank(b) && a.equals(b);
    }

    private static Set<String> sharedTagKeys(Map<String, String> a, Map<String, String> b) {
        if (a.isEmpty() || b.isEmpty()) return Set.of();
        Set<String> shared = new HashSet<>(a.keySet());
        shared.retainAll(b.keySet());
        return shared;
    }
}
