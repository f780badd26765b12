package me.golemcore.context.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a compression pass, including the append that triggered it when
 * returned from the messages endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressionResultDto {
    private String sessionId;
    private String messageId;
    private String requestedAction;
    private String appliedAction;
    private boolean degraded;
    private boolean cancelled;
    private int affectedMessages;
    private long savedTokens;
    private String summaryMessageId;
    private String memoryId;
    private String truncationId;
    private String checkpointId;
    private String autoCheckpointId;
    private long tokensBefore;
    private long tokensAfter;
    private long effectiveLimit;
    private double usageRatio;
    private String detail;
}
