package com.company.correlation.domain;

import com.company.correlation.domain.enums.CorrelationConfidence;
import com.company.correlation.domain.enums.CorrelationStrategy;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of evaluating one rule for one alert against one group.
 */
@Getter
@ToString
public class CorrelationOutcome {

    private final boolean matched;
    private final double score;
    private final CorrelationStrategy strategy;
    private final Map<String, Object> evidence;

    private CorrelationOutcome(boolean matched, double score, CorrelationStrategy strategy,
                               Map<String, Object> evidence) {
        this.matched = matched;
        this.score = clamp(score);
        this.strategy = strategy;
        this.evidence = evidence == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public static CorrelationOutcome matched(CorrelationStrategy strategy, double score,
                                             Map<String, Object> evidence) {
        return new CorrelationOutcome(true, score, strategy, evidence);
    }

    public static CorrelationOutcome noMatch(CorrelationStrategy strategy) {
        return new CorrelationOutcome(false, 0.0, strategy, null);
    }

    public static CorrelationOutcome noMatch(CorrelationStrategy strategy, Map<String, Object> evidence) {
        return new CorrelationOutcome(false, 0.0, strategy, evidence);
    }

    public CorrelationConfidence confidence() {
        return CorrelationConfidence.fromScore(score);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score < 0.0) return 0.0;
        return Math.min(score, 1.0);
    }
}
