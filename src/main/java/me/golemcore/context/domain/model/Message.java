package me.golemcore.context.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A single transcript message of a conversation.
 *
 * <p>
 * Compression state is kept as one {@link CompressionState} plus a
 * {@code replacedBy} reference (the condense id or truncation id of the pass
 * that took the message out of the active set). The legacy flag view
 * ({@code condenseParent}, {@code isTruncationMarker}, {@code truncationId}) is
 * derived from it so the two can never disagree.
 *
 * <p>
 * A synthetic summary message carries {@code summary=true} and its own
 * {@code condenseId}, which the replaced messages point to.
 *
 * <p>
 * Stored content is never rewritten. A pruned tool output keeps its payload and
 * only {@link #getEffectiveContent()} replaces it with a short marker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    public static final String PRUNED_MARKER_FORMAT = "[Tool output pruned: %d chars]";

    private String id;
    private String role;
    private String content;
    private Instant timestamp;
    private String conversationId;
    private Integer tokenCount;

    private String toolCallId;
    private String toolName;

    @Builder.Default
    private CompressionState compressionState = CompressionState.ACTIVE;
    private String replacedBy;

    private boolean summary;
    private String condenseId;

    private boolean pruned;
    private String checkpointId;

    /**
     * Build a synthetic summary message that replaces a condensed range.
     */
    public static Message summaryOf(String id, String conversationId, String condenseId, String content,
            Instant timestamp) {
        Objects.requireNonNull(condenseId, "condenseId");
        return Message.builder()
                .id(id)
                .conversationId(conversationId)
                .role(ROLE_SYSTEM)
                .content(content)
                .timestamp(timestamp)
                .summary(true)
                .condenseId(condenseId)
                .build();
    }

    public static List<Message> activeOnly(List<Message> messages) {
        if (messages == null) {
            return List.of();
        }
        return messages.stream()
                .filter(Objects::nonNull)
                .filter(Message::isActive)
                .toList();
    }

    public void markCondensed(String condenseId) {
        replaceWith(CompressionState.CONDENSED, condenseId);
    }

    public void markTruncated(String truncationId) {
        replaceWith(CompressionState.TRUNCATED, truncationId);
    }

    private void replaceWith(CompressionState state, String reference) {
        Objects.requireNonNull(reference, "reference");
        if (!isActive()) {
            throw new IllegalStateException("Message " + id + " is already " + compressionState);
        }
        this.compressionState = state;
        this.replacedBy = reference;
    }

    @JsonIgnore
    public boolean isActive() {
        return compressionState == null || compressionState == CompressionState.ACTIVE;
    }

    @JsonIgnore
    public String getCondenseParent() {
        return compressionState == CompressionState.CONDENSED ? replacedBy : null;
    }

    @JsonIgnore
    public boolean isTruncationMarker() {
        return compressionState == CompressionState.TRUNCATED;
    }

    @JsonIgnore
    public String getTruncationId() {
        return isTruncationMarker() ? replacedBy : null;
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Content as the model sees it: the pruned marker for a pruned message, the
     * stored content otherwise.
     */
    @JsonIgnore
    public String getEffectiveContent() {
        return pruned ? String.format(PRUNED_MARKER_FORMAT, contentLength()) : content;
    }

    @JsonIgnore
    public int contentLength() {
        return content != null ? content.length() : 0;
    }
}
