package me.golemcore.context.domain.model;

import lombok.Builder;
import me.golemcore.context.domain.exception.ConfigurationException;

/**
 * Promotion policy for mid-term memories.
 *
 * @param daysThreshold
 *            days since the last access before a record may be promoted
 * @param minAccessCount
 *            minimum number of accesses before a record may be promoted
 * @param batchSize
 *            number of candidates examined per run
 */
@Builder(toBuilder = true)
public record MemoryAutoUpgradeConfig(boolean enabled, int daysThreshold, int minAccessCount, int batchSize) {

    public static final int DEFAULT_DAYS_THRESHOLD = 30;
    public static final int DEFAULT_MIN_ACCESS_COUNT = 3;
    public static final int DEFAULT_BATCH_SIZE = 10;

    public MemoryAutoUpgradeConfig {
        if (daysThreshold < 0) {
            throw new ConfigurationException("daysThreshold must not be negative: " + daysThreshold);
        }
        if (minAccessCount < 0) {
            throw new ConfigurationException("minAccessCount must not be negative: " + minAccessCount);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("batchSize must be positive: " + batchSize);
        }
    }

    public static MemoryAutoUpgradeConfig defaults() {
        return new MemoryAutoUpgradeConfig(true, DEFAULT_DAYS_THRESHOLD, DEFAULT_MIN_ACCESS_COUNT,
                DEFAULT_BATCH_SIZE);
    }
}
