package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlertCategory;
import com.company.correlation.domain.enums.AlertSeverity;
import com.company.correlation.domain.enums.AlertStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single alert as received from a producer. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    private static final String TEST_TAG = "test";

    String id;
    AlertSeverity severity;
    AlertCategory category;
    @Builder.Default
    AlertStatus status = AlertStatus.ACTIVE;

    String title;
    String description;
    Instant triggeredAt;

    String sourceHost;
    String sourceComponent;

    @Singular
    Map<String, String> tags;
    @Singular
    Map<String, Double> metricValues;

    /**
     * Synthetic alerts are tagged {@code test=true} by load generators and smoke checks
     */
    public boolean isSynthetic() {
        String value = tags.get(TEST_TAG);
        return value != null && "true".equalsIgnoreCase(value.trim());
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    /**
     * Title and description joined by a single space, null parts treated as empty
     */
    public String getText() {
        String t = title != null ? title : "";
        String d = description != null ? description : "";
        return (t + " " + d).trim();
    }
}
