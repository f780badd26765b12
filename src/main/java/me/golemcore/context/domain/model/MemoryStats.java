package me.golemcore.context.domain.model;

import lombok.Builder;

/**
 * Dry-run overview of the memory store: tier sizes and what the next cleanup
 * run would touch.
 */
@Builder
public record MemoryStats(long totalMidTerm, long totalLongTerm, int expiredCandidates, int danglingCandidates,
        int orphanedCandidates) {
}
