package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.CompactionPreparation;
import me.golemcore.context.domain.model.Message;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the compaction boundary of an active transcript and keeps a tool
 * result on the same side of the cut as the assistant turn that requested it.
 */
@Service
public class CompactionPreparationService {

    public CompactionPreparation prepare(String sessionId, List<Message> activeMessages, int keepLast) {
        List<Message> safeMessages = activeMessages != null ? activeMessages : List.of();
        int total = safeMessages.size();
        int normalizedKeepLast = Math.max(1, keepLast);
        int rawCutIndex = Math.max(0, total - normalizedKeepLast);
        int adjustedCutIndex = moveCutIndexToSafeBoundary(safeMessages, rawCutIndex);

        return CompactionPreparation.builder()
                .sessionId(sessionId)
                .totalMessages(total)
                .keepLastRequested(normalizedKeepLast)
                .rawCutIndex(rawCutIndex)
                .adjustedCutIndex(adjustedCutIndex)
                .splitTurnDetected(adjustedCutIndex != rawCutIndex)
                .messagesToCompact(new ArrayList<>(safeMessages.subList(0, adjustedCutIndex)))
                .messagesToKeep(new ArrayList<>(safeMessages.subList(adjustedCutIndex, total)))
                .build();
    }

    private int moveCutIndexToSafeBoundary(List<Message> messages, int rawCutIndex) {
        if (rawCutIndex <= 0 || rawCutIndex >= messages.size()) {
            return rawCutIndex;
        }

        int safeCutIndex = rawCutIndex;
        while (safeCutIndex > 0 && isBoundarySplit(messages, safeCutIndex)) {
            safeCutIndex--;
        }
        return safeCutIndex;
    }

    private boolean isBoundarySplit(List<Message> messages, int cutIndex) {
        Message firstKept = messages.get(cutIndex);
        if (firstKept == null || !firstKept.isToolMessage()) {
            return false;
        }
        // a tool result whose call happened before the cut: keep them together
        Message previous = messages.get(cutIndex - 1);
        return previous != null && (previous.isToolMessage() || previous.isAssistantMessage());
    }
}
