package com.company.correlation.config;

import com.company.correlation.domain.CorrelationRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code correlation.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "correlation")
public class CorrelationProperties {

    /** Hard cap on groups held in memory; the oldest are evicted beyond it */
    @Min(1)
    private int maxGroups = 1000;

    /** Groups older than this are removed whatever their status */
    @NotNull
    private Duration maxGroupAge = Duration.ofHours(24);

    /** Open or suppressed groups with no activity for this long are resolved by the sweep */
    @NotNull
    private Duration inactivityTimeout = Duration.ofHours(2);

    /** How long a resolved group is kept before removal */
    @NotNull
    private Duration resolvedRetention = Duration.ofHours(1);

    /** Number of recent samples averaged for processing latency */
    @Min(1)
    private int latencyWindowSize = 1000;

    private final Lifecycle lifecycle = new Lifecycle();
    private final Cache cache = new Cache();
    private final Executor executor = new Executor();

    /** Rules registered at startup, in declaration order */
    @Valid
    private List<CorrelationRule> rules = new ArrayList<>();

    @Data
    public static class Lifecycle {
        private boolean enabled = true;
        private long sweepIntervalMs = 60000;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotBlank
        private String keyPrefix = "correlation:group:";
        @NotNull
        private Duration commandTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 500;
        private int awaitTerminationSeconds = 30;
    }
}
