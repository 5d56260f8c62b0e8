package com.company.correlation.domain;

import com.company.correlation.domain.enums.AlertCategory;
import com.company.correlation.domain.enums.AlertSeverity;
import com.company.correlation.domain.enums.CorrelationStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds one correlation strategy to its weights, thresholds, filters and suppression settings.
 * Instances are bound from {@code correlation.rules} or built in code and handed to the engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRule {

    @NotBlank(message = "Rule name is required")
    private String name;

    @NotNull(message = "Strategy is required")
    private CorrelationStrategy strategy;

    @Builder.Default
    private boolean enabled = true;

    // Lower value = evaluated earlier
    @Builder.Default
    private int priority = 100;

    @Builder.Default
    @DecimalMin(value = "0.0", inclusive = false, message = "Weight must be positive")
    @DecimalMax(value = "10.0", message = "Weight must not exceed 10")
    private double weight = 1.0;

    @Builder.Default
    @NotNull(message = "Time window is required")
    private Duration timeWindow = Duration.ofMinutes(10);

    // Spatial
    @Builder.Default
    @DecimalMin(value = "0.0", message = "Host weight must not be negative")
    private double hostWeight = 2.0;

    @Builder.Default
    @DecimalMin(value = "0.0", message = "Component weight must not be negative")
    private double componentWeight = 1.5;

    @Builder.Default
    @DecimalMin(value = "0.0", message = "Category weight must not be negative")
    private double categoryWeight = 1.2;

    // Semantic
    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minSimilarityScore = 0.5;

    // Metric pattern
    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double metricCorrelationThreshold = 0.8;

    // Pattern match
    private String patternRegex;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double patternConfidence = 0.8;

    // Similarity heuristic
    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.75;

    // Suppression
    @Builder.Default
    @Min(value = 1, message = "suppressAfterCount must be at least 1")
    private int suppressAfterCount = 10;

    @Builder.Default
    @Min(value = 2, message = "maxGroupSize must be at least 2")
    private int maxGroupSize = 50;

    // Filters
    @Builder.Default
    private Set<AlertSeverity> severityFilter = EnumSet.noneOf(AlertSeverity.class);

    @Builder.Default
    private Set<AlertCategory> categoryFilter = EnumSet.noneOf(AlertCategory.class);

    @Builder.Default
    private Map<String, String> tagFilters = new HashMap<>();

    @Builder.Default
    @Valid
    private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();

    @AssertTrue(message = "Time window must be positive")
    public boolean isTimeWindowPositive() {
        return timeWindow == null || (!timeWindow.isNegative() && !timeWindow.isZero());
    }

    @AssertTrue(message = "PATTERN_MATCH rules require a patternRegex")
    public boolean isPatternPresentWhenRequired() {
        return strategy != CorrelationStrategy.PATTERN_MATCH
                || (patternRegex != null && !patternRegex.isBlank());
    }

    /**
     * Deep enough copy that the registry owns its own collections
     */
    public CorrelationRule copy() {
        return toBuilder()
                .severityFilter(severityFilter == null || severityFilter.isEmpty()
                        ? EnumSet.noneOf(AlertSeverity.class) : EnumSet.copyOf(severityFilter))
                .categoryFilter(categoryFilter == null || categoryFilter.isEmpty()
                        ? EnumSet.noneOf(AlertCategory.class) : EnumSet.copyOf(categoryFilter))
                .tagFilters(tagFilters == null ? new HashMap<>() : new HashMap<>(tagFilters))
                .maintenanceWindows(copyWindows())
                .build();
    }

    private List<MaintenanceWindow> copyWindows() {
        List<MaintenanceWindow> copies = new ArrayList<>();
        if (maintenanceWindows != null) {
            for (MaintenanceWindow window : maintenanceWindows) {
                copies.add(new MaintenanceWindow(window.getStart(), window.getEnd()));
            }
        }
        return copies;
    }
}
