package me.golemcore.context.domain.model;

import java.time.Instant;

/**
 * One entry of a memory record's promotion history.
 */
public record TierTransition(MemoryTier from, MemoryTier to, Instant at) {
}
