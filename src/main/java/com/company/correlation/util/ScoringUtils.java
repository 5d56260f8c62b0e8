package com.company.correlation.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public class ScoringUtils {

    /**
     * Exponential decay e^(-delta/window); 1.0 at zero distance, e^-1 at the window edge
     */
    public static double temporalDecay(Duration delta, Duration window) {
        double windowSeconds = toSeconds(window);
        if (windowSeconds <= 0) return 0.0;
        return Math.exp(-toSeconds(delta) / windowSeconds);
    }

    public static Duration distance(Instant a, Instant b) {
        return Duration.between(a, b).abs();
    }

    public static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    /**
     * Relative closeness of two readings: 1.0 when equal (including both zero),
     * 0.0 when exactly one is zero
     */
    public static double metricCorrelation(double v1, double v2) {
        if (v1 == 0.0 && v2 == 0.0) return 1.0;
        if (v1 == 0.0 || v2 == 0.0) return 0.0;
        double largest = Math.max(Math.abs(v1), Math.abs(v2));
        return Math.max(0.0, 1.0 - Math.abs(v1 - v2) / largest);
    }

    /**
     * Average correlation over the keys both maps share; 0 when none are shared
     */
    public static double metricSimilarity(Map<String, Double> metrics1, Map<String, Double> metrics2) {
        if (metrics1 == null || metrics2 == null || metrics1.isEmpty() || metrics2.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        int shared = 0;
        for (Map.Entry<String, Double> entry : metrics1.entrySet()) {
            Double other = metrics2.get(entry.getKey());
            if (other == null || entry.getValue() == null) continue;
            sum += metricCorrelation(entry.getValue(), other);
            shared++;
        }
        return shared == 0 ? 0.0 : sum / shared;
    }

    public static double cap(double score) {
        if (Double.isNaN(score) || score < 0.0) return 0.0;
        return Math.min(score, 1.0);
    }

    public static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
