package me.golemcore.context.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial settings update. Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsUpdateRequest {
    private ContextSection context;
    private AutoUpgradeSection autoUpgrade;
    private CleanupSection cleanup;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContextSection {
        private Boolean enabled;
        private Integer maxTokens;
        private Integer modelContextLimit;
        private Integer modelOutputLimit;
        private Double pruneThreshold;
        private Double compactThreshold;
        private Double truncateThreshold;
        private Integer messagesToKeep;
        private Integer checkpointInterval;
        private Integer pruneMinChars;
        private Boolean checkpointBeforeCompression;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutoUpgradeSection {
        private Boolean enabled;
        private Integer daysThreshold;
        private Integer minAccessCount;
        private Integer batchSize;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CleanupSection {
        private Integer retentionDays;
        private Integer minAccessCount;
    }
}
