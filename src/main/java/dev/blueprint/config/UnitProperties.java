package dev.blueprint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Per-unit execution limits. Overrides are keyed by unit name; anything not overridden
 * falls back to the defaults. Names listed in {@code placeholders} are registered as
 * not-implemented units when no real implementation exists.
 */
@ConfigurationProperties(prefix = "blueprint.units")
public record UnitProperties(Duration defaultTimeout, int defaultRetryCount, Duration retryDelay,
                             Map<String, UnitConfig> overrides, List<String> placeholders) {
    public UnitProperties {
        if (defaultTimeout == null) defaultTimeout = Duration.ofMinutes(5);
        if (defaultRetryCount < 0) defaultRetryCount = 0;
        if (retryDelay == null) retryDelay = Duration.ofSeconds(2);
        if (overrides == null) overrides = Map.of();
        if (placeholders == null) placeholders = List.of();
    }

    public record UnitConfig(Duration timeout, Integer retryCount) {}

    public static UnitProperties defaults() {
        return new UnitProperties(null, 0, null, null, null);
    }

    public Duration timeoutFor(String unitName) {
        UnitConfig config = overrides.get(unitName);
        return config != null && config.timeout() != null ? config.timeout() : defaultTimeout;
    }

    public int retryCountFor(String unitName) {
        UnitConfig config = overrides.get(unitName);
        int count = config != null && config.retryCount() != null ? config.retryCount() : defaultRetryCount;
        return Math.max(0, count);
    }
}
