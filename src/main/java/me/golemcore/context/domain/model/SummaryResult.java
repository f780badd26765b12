package me.golemcore.context.domain.model;

import java.util.List;

/**
 * Output of the summarizer collaborator.
 */
public record SummaryResult(String summaryText, List<String> keyTopics, List<String> decisions) {

    public SummaryResult {
        keyTopics = keyTopics != null ? List.copyOf(keyTopics) : List.of();
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }

    public boolean hasText() {
        return summaryText != null && !summaryText.isBlank();
    }
}
