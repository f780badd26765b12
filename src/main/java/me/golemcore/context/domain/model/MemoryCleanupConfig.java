package me.golemcore.context.domain.model;

import lombok.Builder;
import me.golemcore.context.domain.exception.ConfigurationException;

/**
 * Expiry policy for mid-term memories: records not accessed for
 * {@code retentionDays} and accessed fewer than {@code minAccessCount} times
 * are deleted.
 */
@Builder(toBuilder = true)
public record MemoryCleanupConfig(int retentionDays, int minAccessCount) {

    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_MIN_ACCESS_COUNT = 3;

    public MemoryCleanupConfig {
        if (retentionDays <= 0) {
            throw new ConfigurationException("retentionDays must be positive: " + retentionDays);
        }
        if (minAccessCount < 0) {
            throw new ConfigurationException("minAccessCount must not be negative: " + minAccessCount);
        }
    }

    public static MemoryCleanupConfig defaults() {
        return new MemoryCleanupConfig(DEFAULT_RETENTION_DAYS, DEFAULT_MIN_ACCESS_COUNT);
    }
}
