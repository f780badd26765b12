package me.golemcore.context.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Split of the active transcript before compaction.
 */
@Builder
public record CompactionPreparation(String sessionId, int totalMessages, int keepLastRequested, int rawCutIndex,
        int adjustedCutIndex, boolean splitTurnDetected, List<Message> messagesToCompact,
        List<Message> messagesToKeep) {

    public boolean hasMessagesToCompact() {
        return messagesToCompact != null && !messagesToCompact.isEmpty();
    }
}
