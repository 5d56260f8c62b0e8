package com.company.correlation.domain.enums;

/**
 * Lifecycle of an alert group. Transitions only move forward
 * (OPEN -> SUPPRESSED -> RESOLVED, or OPEN -> RESOLVED); reopening is the one exception.
 */
public enum GroupStatus {
    OPEN,
    SUPPRESSED,
    RESOLVED;

    public boolean canTransitionTo(GroupStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case OPEN -> true;
            case SUPPRESSED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
