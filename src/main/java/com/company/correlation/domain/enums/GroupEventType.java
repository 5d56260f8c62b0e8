package com.company.correlation.domain.enums;

public enum GroupEventType {
    CREATED,
    UPDATED,
    SUPPRESSED,
    RESOLVED,
    REOPENED
}
