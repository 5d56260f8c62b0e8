package com.company.correlation.domain.enums;

/**
 * Discrete confidence levels, declared in ascending order.
 */
public enum CorrelationConfidence {
    VERY_LOW(0.0),
    LOW(0.3),
    MEDIUM(0.5),
    HIGH(0.7),
    VERY_HIGH(0.9);

    private final double lowerBound;

    CorrelationConfidence(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public boolean isAtLeast(CorrelationConfidence other) {
        return this.compareTo(other) >= 0;
    }

    public static CorrelationConfidence fromScore(double score) {
        if (score >= VERY_HIGH.lowerBound) return VERY_HIGH;
        if (score >= HIGH.lowerBound) return HIGH;
        if (score >= MEDIUM.lowerBound) return MEDIUM;
        if (score >= LOW.lowerBound) return LOW;
        return VERY_LOW;
    }
}
