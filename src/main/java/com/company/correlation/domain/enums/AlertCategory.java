package com.company.correlation.domain.enums;

public enum AlertCategory {
    PERFORMANCE,
    SECURITY,
    AVAILABILITY,
    CAPACITY,
    QUALITY,
    BUSINESS
}
