package io.strata.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Tier placement thresholds and windows.
 *
 * <p>An item evicted from the hot cache is promoted to the warm graph when its importance is at or
 * above {@code warmThreshold} (or above {@code hotFloor}), archived when it is at or above
 * {@code retentionFloor}, and dropped otherwise.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    int hotCapacity,
    Duration hotTtl,
    double hotFloor,
    double warmThreshold,
    double retentionFloor,
    Duration warmRetention,
    int maxHops,
    double recencyWeight,
    boolean failFast
) {

    public MemoryConfig {
        if (hotCapacity < 1) {
            throw new IllegalArgumentException("hotCapacity must be at least 1");
        }
        hotTtl = hotTtl == null ? Duration.ofHours(1) : hotTtl;
        warmRetention = warmRetention == null ? Duration.ofDays(7) : warmRetention;
        if (retentionFloor < 0 || warmThreshold < retentionFloor) {
            throw new IllegalArgumentException("thresholds must satisfy 0 <= retentionFloor <= warmThreshold");
        }
        maxHops = Math.max(0, maxHops);
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(
            20,
            Duration.ofHours(1),
            7.0,
            4.0,
            2.0,
            Duration.ofDays(7),
            2,
            3.0,
            false
        );
    }
}
