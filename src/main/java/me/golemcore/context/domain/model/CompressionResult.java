package me.golemcore.context.domain.model;

import lombok.Builder;

/**
 * Outcome of one compression pass, reported back to the caller.
 *
 * <p>
 * {@code degraded} is set when the requested action could not be applied and
 * the engine fell back to a lighter one. {@code cancelled} means the pass was
 * interrupted and nothing was written.
 */
@Builder(toBuilder = true)
public record CompressionResult(String sessionId, CompressionAction requestedAction,
        CompressionAction appliedAction, boolean degraded, boolean cancelled, int affectedMessages,
        long savedTokens, Message summaryMessage, CompactedSession compactedSession, String truncationId,
        Checkpoint checkpoint, TokenUsage usageBefore, TokenUsage usageAfter, String detail) {

    public static CompressionResult none(String sessionId, TokenUsage usage) {
        return CompressionResult.builder()
                .sessionId(sessionId)
                .requestedAction(CompressionAction.NONE)
                .appliedAction(CompressionAction.NONE)
                .usageBefore(usage)
                .usageAfter(usage)
                .build();
    }

    public boolean changedTranscript() {
        return affectedMessages > 0 || summaryMessage != null;
    }
}
