package me.golemcore.context.domain.model;

/**
 * Result of appending a message: the stored message, the compression pass it
 * triggered and the automatic checkpoint, if one was due.
 */
public record AppendOutcome(Message message, CompressionResult compression, Checkpoint autoCheckpoint) {
}
