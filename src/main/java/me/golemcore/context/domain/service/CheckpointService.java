package me.golemcore.context.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.port.outbound.CheckpointStorePort;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates, lists, restores and deletes transcript checkpoints.
 *
 * <p>
 * A checkpoint captures the full history of a session, including messages that
 * compression took out of the active set, so restoring one always gives back
 * the exact transcript. Restore hands the snapshot to the caller and does not
 * touch the stored messages.
 *
 * <p>
 * Messages record the first checkpoint that captured them in
 * {@code checkpointId}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointService {

    private static final String ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int ID_SUFFIX_LENGTH = 6;
    private static final int TOPIC_PREVIEW_LENGTH = 80;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final MessageStorePort messageStore;
    private final CheckpointStorePort checkpointStore;
    private final TokenBudgetEvaluator evaluator;
    private final Clock clock;

    public Checkpoint create(String sessionId, String name) {
        Instant now = clock.instant();
        String checkpointId = generateId(now);
        List<Message> history = messageStore.listByConversation(sessionId);

        List<Message> newlyCaptured = new ArrayList<>();
        for (Message message : history) {
            if (message.getCheckpointId() == null) {
                message.setCheckpointId(checkpointId);
                newlyCaptured.add(message);
            }
        }

        Checkpoint checkpoint = Checkpoint.builder()
                .id(checkpointId)
                .sessionId(sessionId)
                .name(name != null && !name.isBlank() ? name.trim() : defaultName(sessionId))
                .messageCount(history.size())
                .tokenCount(evaluator.sumTokens(Message.activeOnly(history)))
                .summary(describe(history))
                .messagesSnapshot(history)
                .createdAt(now)
                .build();

        checkpointStore.save(checkpoint);
        if (!newlyCaptured.isEmpty()) {
            try {
                messageStore.updateAll(newlyCaptured, List.of());
            } catch (StorageException e) {
                discard(checkpoint, e);
                throw e;
            }
        }

        log.info("[Checkpoint] Created '{}' ({}) for session {}: {} messages",
                checkpoint.name(), checkpointId, sessionId, history.size());
        return checkpoint;
    }

    public Checkpoint createAutomatic(String sessionId, int messageCount) {
        return create(sessionId, "Auto-" + messageCount);
    }

    /**
     * Whether {@code checkpointInterval} messages were added since the latest
     * checkpoint of the session.
     */
    public boolean shouldAutoCheckpoint(String sessionId, int messageCount, ContextEngineConfig config) {
        if (!config.isAutoCheckpointEnabled()) {
            return false;
        }
        int captured = checkpointStore.findLatest(sessionId)
                .map(Checkpoint::messageCount)
                .orElse(0);
        return messageCount - captured >= config.checkpointInterval();
    }

    public List<Checkpoint> list(String sessionId) {
        return checkpointStore.listBySession(sessionId);
    }

    public Optional<Checkpoint> get(String checkpointId) {
        return checkpointStore.findById(checkpointId);
    }

    /**
     * Transcript captured by the checkpoint, as fresh copies the caller may use as
     * its working transcript.
     */
    public Optional<List<Message>> restore(String checkpointId) {
        Optional<Checkpoint> checkpoint = checkpointStore.findById(checkpointId);
        checkpoint.ifPresent(cp -> log.info("[Checkpoint] Restoring '{}' ({}) of session {}: {} messages",
                cp.name(), cp.id(), cp.sessionId(), cp.messageCount()));
        return checkpoint.map(Checkpoint::copyMessages);
    }

    public boolean delete(String checkpointId) {
        boolean deleted = checkpointStore.delete(checkpointId);
        if (deleted) {
            log.info("[Checkpoint] Deleted {}", checkpointId);
        }
        return deleted;
    }

    public int deleteBySession(String sessionId) {
        int deleted = checkpointStore.deleteBySession(sessionId);
        log.info("[Checkpoint] Deleted {} checkpoints of session {}", deleted, sessionId);
        return deleted;
    }

    String describe(List<Message> history) {
        String description = "Snapshot - " + history.size() + " messages";
        for (int i = history.size() - 1; i >= 0; i--) {
            Message message = history.get(i);
            if (message.isUserMessage() && message.getContent() != null && !message.getContent().isBlank()) {
                String content = message.getContent().strip().replaceAll("\\s+", " ");
                String preview = content.length() > TOPIC_PREVIEW_LENGTH
                        ? content.substring(0, TOPIC_PREVIEW_LENGTH) + "..."
                        : content;
                return description + ", last topic: " + preview;
            }
        }
        return description;
    }

    private String defaultName(String sessionId) {
        return "Checkpoint " + (checkpointStore.listBySession(sessionId).size() + 1);
    }

    private String generateId(Instant now) {
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(ID_CHARS.charAt(RANDOM.nextInt(ID_CHARS.length())));
        }
        return "cp-" + now.toEpochMilli() + "-" + suffix;
    }

    private void discard(Checkpoint checkpoint, StorageException cause) {
        try {
            checkpointStore.delete(checkpoint.id());
        } catch (StorageException e) {
            cause.addSuppressed(e);
            log.error("[Checkpoint] Failed to discard checkpoint {} after failed capture", checkpoint.id(), e);
        }
    }
}
