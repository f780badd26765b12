package me.golemcore.context.domain.model;

/**
 * Token usage of the active part of a transcript against the effective limit.
 */
public record TokenUsage(long usedTokens, long effectiveLimit, double usageRatio, int activeMessages) {

    public static TokenUsage empty(long effectiveLimit) {
        return new TokenUsage(0, effectiveLimit, 0.0, 0);
    }
}
