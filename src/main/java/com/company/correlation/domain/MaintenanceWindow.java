package com.company.correlation.domain;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Period during which a rule is not applied. Both bounds are inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindow {

    @NotNull(message = "Maintenance window start is required")
    private Instant start;

    @NotNull(message = "Maintenance window end is required")
    private Instant end;

    public boolean contains(Instant instant) {
        if (instant == null || start == null || end == null) return false;
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @AssertTrue(message = "Maintenance window start must not be after its end")
    public boolean isOrdered() {
        return start == null || end == null || !start.isAfter(end);
    }
}
