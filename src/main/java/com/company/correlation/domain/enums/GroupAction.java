package com.company.correlation.domain.enums;

/**
 * What processing an alert did to the store.
 */
public enum GroupAction {
    CREATED,
    MERGED,
    EXISTING
}
