package com.company.correlation.domain.enums;

public enum CorrelationStrategy {
    TEMPORAL,
    SPATIAL,
    SEMANTIC,
    METRIC_PATTERN,
    PATTERN_MATCH,
    TIME_WINDOW,
    SIMILARITY_HEURISTIC;

    public String getTagValue() {
        return name().toLowerCase();
    }
}
