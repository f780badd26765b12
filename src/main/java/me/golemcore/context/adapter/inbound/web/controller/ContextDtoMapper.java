package me.golemcore.context.adapter.inbound.web.controller;

import me.golemcore.context.adapter.inbound.web.dto.CheckpointDto;
import me.golemcore.context.adapter.inbound.web.dto.CompressionResultDto;
import me.golemcore.context.adapter.inbound.web.dto.MemoryDto;
import me.golemcore.context.adapter.inbound.web.dto.MessageDto;
import me.golemcore.context.domain.model.AppendOutcome;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.CompressionResult;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.TokenUsage;

import java.time.Instant;
import java.util.List;

/**
 * Domain to DTO conversions shared by the API controllers.
 */
final class ContextDtoMapper {

    private ContextDtoMapper() {
    }

    /**
     * @param storedContent
     *            {@code true} for the full history and checkpoints, which carry the
     *            stored payload; {@code false} for the active view, which shows
     *            pruned tool outputs as a marker
     */
    static MessageDto toMessageDto(Message message, boolean storedContent) {
        return MessageDto.builder()
                .id(message.getId())
                .role(message.getRole())
                .content(storedContent ? message.getContent() : message.getEffectiveContent())
                .timestamp(format(message.getTimestamp()))
                .tokenCount(message.getTokenCount())
                .toolCallId(message.getToolCallId())
                .toolName(message.getToolName())
                .compressionState(message.getCompressionState() != null ? message.getCompressionState().name()
                        : null)
                .replacedBy(message.getReplacedBy())
                .summary(message.isSummary())
                .condenseId(message.getCondenseId())
                .pruned(message.isPruned())
                .checkpointId(message.getCheckpointId())
                .build();
    }

    static List<MessageDto> toMessageDtos(List<Message> messages, boolean storedContent) {
        return messages.stream().map(message -> toMessageDto(message, storedContent)).toList();
    }

    static CheckpointDto toCheckpointDto(Checkpoint checkpoint, boolean includeMessages) {
        return CheckpointDto.builder()
                .id(checkpoint.id())
                .sessionId(checkpoint.sessionId())
                .name(checkpoint.name())
                .messageCount(checkpoint.messageCount())
                .tokenCount(checkpoint.tokenCount())
                .summary(checkpoint.summary())
                .createdAt(format(checkpoint.createdAt()))
                .messages(includeMessages ? toMessageDtos(checkpoint.messagesSnapshot(), true) : null)
                .build();
    }

    static MemoryDto toMemoryDto(CompactedSession memory) {
        return MemoryDto.builder()
                .id(memory.getId())
                .sessionId(memory.getSessionId())
                .summary(memory.getSummary())
                .keyTopics(memory.getKeyTopics())
                .decisions(memory.getDecisions())
                .messageStart(memory.getMessageStart())
                .messageEnd(memory.getMessageEnd())
                .messageCount(memory.getMessageCount())
                .createdAt(format(memory.getCreatedAt()))
                .lastAccessedAt(format(memory.getLastAccessedAt()))
                .accessCount(memory.getAccessCount())
                .tier(memory.getTier() != null ? memory.getTier().getValue() : null)
                .tierUpdatedAt(format(memory.getTierUpdatedAt()))
                .build();
    }

    static CompressionResultDto toCompressionDto(CompressionResult result) {
        TokenUsage before = result.usageBefore();
        TokenUsage after = result.usageAfter() != null ? result.usageAfter() : before;
        return CompressionResultDto.builder()
                .sessionId(result.sessionId())
                .requestedAction(result.requestedAction() != null ? result.requestedAction().value() : null)
                .appliedAction(result.appliedAction() != null ? result.appliedAction().value() : null)
                .degraded(result.degraded())
                .cancelled(result.cancelled())
                .affectedMessages(result.affectedMessages())
                .savedTokens(result.savedTokens())
                .summaryMessageId(result.summaryMessage() != null ? result.summaryMessage().getId() : null)
                .memoryId(result.compactedSession() != null ? result.compactedSession().getId() : null)
                .truncationId(result.truncationId())
                .checkpointId(result.checkpoint() != null ? result.checkpoint().id() : null)
                .tokensBefore(before != null ? before.usedTokens() : 0)
                .tokensAfter(after != null ? after.usedTokens() : 0)
                .effectiveLimit(after != null ? after.effectiveLimit() : 0)
                .usageRatio(after != null ? after.usageRatio() : 0.0)
                .detail(result.detail())
                .build();
    }

    static CompressionResultDto toCompressionDto(AppendOutcome outcome) {
        CompressionResultDto dto = toCompressionDto(outcome.compression());
        dto.setMessageId(outcome.message().getId());
        if (outcome.autoCheckpoint() != null) {
            dto.setAutoCheckpointId(outcome.autoCheckpoint().id());
        }
        return dto;
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
