package com.company.correlation.domain.enums;

/**
 * Declared in ascending order of urgency.
 */
public enum AlertSeverity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(AlertSeverity other) {
        return other == null || this.compareTo(other) > 0;
    }
}
