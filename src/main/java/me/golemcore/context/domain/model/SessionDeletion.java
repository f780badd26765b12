package me.golemcore.context.domain.model;

/**
 * What was removed together with a conversation.
 */
public record SessionDeletion(String sessionId, int messages, int checkpoints, int midTermMemories) {
}
