package com.company.correlation.domain.enums;

/**
 * Status of an individual alert as reported by the producer.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED,
    EXPIRED
}
