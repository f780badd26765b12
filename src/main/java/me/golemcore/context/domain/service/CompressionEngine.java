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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.domain.exception.SummarizationException;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.CompactionPreparation;
import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.CompressionResult;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SummaryResult;
import me.golemcore.context.domain.model.TokenUsage;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.MessageStorePort;
import me.golemcore.context.port.outbound.SummarizerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies prune, compact or truncate to the active transcript of a session.
 *
 * <p>
 * None of the actions deletes a stored message:
 * <ul>
 * <li><b>prune</b> flags old, oversized tool outputs so the active view shows a
 * short marker instead of the payload</li>
 * <li><b>compact</b> condenses the old part of the transcript into one summary
 * message and writes a mid-term memory record</li>
 * <li><b>truncate</b> takes the oldest messages out of the active set</li>
 * </ul>
 *
 * <p>
 * Compact depends on the summarizer. If it fails or times out, nothing of the
 * compaction is written and the engine prunes instead, reporting the result as
 * degraded. If the calling thread is interrupted while waiting for the summary
 * the pass ends with a cancelled result and no writes.
 *
 * <p>
 * Callers serialize passes per session, see {@link ContextSessionCoordinator}.
 */
@Service
@Slf4j
public class CompressionEngine {

    static final String SUMMARY_PREFIX = "[Conversation summary]\n";

    static final String HINT_PROMPT = """
            Summarize the earlier part of this conversation so it can replace the original messages.
            Keep what is needed to continue the conversation:
            - what was discussed and what has been accomplished
            - decisions made and their rationale
            - user preferences and constraints
            - important details such as file names, commands, settings, IDs and URLs
            - open questions and next steps
            Keep it factual and write in the language the conversation uses.""";

    private final MessageStorePort messageStore;
    private final SummarizerPort summarizerPort;
    private final TokenBudgetEvaluator evaluator;
    private final CompactionPreparationService preparationService;
    private final HeuristicMemoryExtractor memoryExtractor;
    private final MidTermMemoryService midTermMemoryService;
    private final CheckpointService checkpointService;
    private final EngineProperties properties;
    private final Clock clock;

    public CompressionEngine(MessageStorePort messageStore, SummarizerPort summarizerPort,
            TokenBudgetEvaluator evaluator, CompactionPreparationService preparationService,
            HeuristicMemoryExtractor memoryExtractor, MidTermMemoryService midTermMemoryService,
            CheckpointService checkpointService, EngineProperties properties, Clock clock) {
        this.messageStore = messageStore;
        this.summarizerPort = summarizerPort;
        this.evaluator = evaluator;
        this.preparationService = preparationService;
        this.memoryExtractor = memoryExtractor;
        this.midTermMemoryService = midTermMemoryService;
        this.checkpointService = checkpointService;
        this.properties = properties;
        this.clock = clock;
    }

    public CompressionResult apply(String sessionId, CompressionAction action, ContextEngineConfig config) {
        return switch (action) {
        case PRUNE -> prune(sessionId, config);
        case COMPACT -> compact(sessionId, config);
        case TRUNCATE -> truncate(sessionId, config);
        case NONE -> CompressionResult.none(sessionId,
                evaluator.measure(messageStore.listActive(sessionId), config));
        };
    }

    /**
     * Flag oversized tool outputs outside the protected tail as pruned. The stored
     * payload stays as it was. Already pruned messages are left alone, so a second
     * pass without new messages writes nothing.
     */
    public CompressionResult prune(String sessionId, ContextEngineConfig config) {
        List<Message> active = messageStore.listActive(sessionId);
        TokenUsage before = evaluator.measure(active, config);

        int protectFrom = Math.max(0, active.size() - config.messagesToKeep());
        List<Message> pruned = new ArrayList<>();
        for (Message message : active.subList(0, protectFrom)) {
            if (isPrunable(message, config)) {
                message.setPruned(true);
                pruned.add(message);
            }
        }

        if (pruned.isEmpty()) {
            log.debug("[Compaction] Nothing to prune in session {}", sessionId);
            return result(sessionId, CompressionAction.PRUNE, before, before)
                    .detail("nothing to prune")
                    .build();
        }

        messageStore.updateAll(pruned, List.of());
        TokenUsage after = evaluator.measure(active, config);
        log.info("[Compaction] Pruned {} tool outputs in session {}: ~{} -> ~{} tokens",
                pruned.size(), sessionId, before.usedTokens(), after.usedTokens());
        return result(sessionId, CompressionAction.PRUNE, before, after)
                .affectedMessages(pruned.size())
                .build();
    }

    /**
     * Condense everything older than the protected tail into one summary message
     * and record the summary as a mid-term memory.
     */
    public CompressionResult compact(String sessionId, ContextEngineConfig config) {
        List<Message> active = messageStore.listActive(sessionId);
        TokenUsage before = evaluator.measure(active, config);

        CompactionPreparation preparation = preparationService.prepare(sessionId, active,
                config.messagesToKeep());
        if (!preparation.hasMessagesToCompact()) {
            log.debug("[Compaction] No messages to compact in session {} (keepLast={}), pruning instead",
                    sessionId, config.messagesToKeep());
            return asRequested(prune(sessionId, config), false, "nothing old enough to compact");
        }
        List<Message> toCompact = preparation.messagesToCompact();

        SummaryResult summary;
        try {
            summary = requestSummary(toCompact);
        } catch (SummarizationException e) {
            log.warn("[Compaction] Summarization failed for session {}: {}. Falling back to prune",
                    sessionId, e.getMessage());
            return asRequested(prune(sessionId, config), true, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Compaction] Compaction of session {} cancelled", sessionId);
            return cancelled(sessionId, CompressionAction.COMPACT, before);
        }
        if (Thread.currentThread().isInterrupted()) {
            log.info("[Compaction] Compaction of session {} cancelled after summary", sessionId);
            return cancelled(sessionId, CompressionAction.COMPACT, before);
        }

        Checkpoint safety = safetyCheckpoint(sessionId, CompressionAction.COMPACT, config);

        String condenseId = UUID.randomUUID().toString();
        Message first = toCompact.get(0);
        Message last = toCompact.get(toCompact.size() - 1);
        String content = SUMMARY_PREFIX + summary.summaryText().trim();
        Message summaryMessage = Message.summaryOf(UUID.randomUUID().toString(), sessionId, condenseId,
                content, last.getTimestamp());
        summaryMessage.setTokenCount(evaluator.estimateTokens(content));

        List<String> keyTopics = !summary.keyTopics().isEmpty() ? summary.keyTopics()
                : memoryExtractor.extractTopics(toCompact);
        List<String> decisions = !summary.decisions().isEmpty() ? summary.decisions()
                : memoryExtractor.extractDecisions(toCompact);

        CompactedSession memory = midTermMemoryService.create(sessionId, summary.summaryText().trim(), keyTopics,
                decisions, first.getId(), last.getId(), toCompact.size());
        for (Message message : toCompact) {
            message.markCondensed(condenseId);
        }
        try {
            messageStore.updateAll(toCompact, List.of(summaryMessage));
        } catch (StorageException e) {
            discardMemory(memory, e);
            throw e;
        }

        List<Message> remaining = new ArrayList<>(preparation.messagesToKeep());
        remaining.add(0, summaryMessage);
        TokenUsage after = evaluator.measure(remaining, config);
        log.info("[Compaction] Compacted {} messages of session {} into summary {}: ~{} -> ~{} tokens",
                toCompact.size(), sessionId, condenseId, before.usedTokens(), after.usedTokens());

        return result(sessionId, CompressionAction.COMPACT, before, after)
                .affectedMessages(toCompact.size())
                .summaryMessage(summaryMessage)
                .compactedSession(memory)
                .checkpoint(safety)
                .detail(preparation.splitTurnDetected() ? "cut moved to keep a tool result with its call" : null)
                .build();
    }

    /**
     * Take the oldest active messages out of the active set until usage falls
     * below the compact threshold. The protected tail is never truncated.
     */
    public CompressionResult truncate(String sessionId, ContextEngineConfig config) {
        List<Message> active = messageStore.listActive(sessionId);
        TokenUsage before = evaluator.measure(active, config);
        double limit = before.effectiveLimit();

        int protectFrom = Math.max(0, active.size() - config.messagesToKeep());
        long remaining = before.usedTokens();
        int cutEnd = 0;
        while (cutEnd < protectFrom && remaining / limit >= config.compactThreshold()) {
            remaining -= evaluator.tokensOf(active.get(cutEnd));
            cutEnd++;
        }
        while (cutEnd > 0 && cutEnd < protectFrom && active.get(cutEnd).isToolMessage()) {
            remaining -= evaluator.tokensOf(active.get(cutEnd));
            cutEnd++;
        }

        if (cutEnd == 0) {
            log.debug("[Compaction] Nothing to truncate in session {}", sessionId);
            return result(sessionId, CompressionAction.TRUNCATE, before, before)
                    .detail("nothing to truncate")
                    .build();
        }

        Checkpoint safety = safetyCheckpoint(sessionId, CompressionAction.TRUNCATE, config);

        String truncationId = UUID.randomUUID().toString();
        List<Message> cut = new ArrayList<>(active.subList(0, cutEnd));
        for (Message message : cut) {
            message.markTruncated(truncationId);
        }
        messageStore.updateAll(cut, List.of());

        TokenUsage after = evaluator.measure(active.subList(cutEnd, active.size()), config);
        String detail = null;
        if (after.usageRatio() >= config.compactThreshold()) {
            detail = "recent messages alone exceed the compact threshold";
            log.warn("[Compaction] Session {} still at {}% after truncation: {}", sessionId,
                    Math.round(after.usageRatio() * 100), detail);
        }
        log.info("[Compaction] Truncated {} messages of session {} ({}): ~{} -> ~{} tokens",
                cut.size(), sessionId, truncationId, before.usedTokens(), after.usedTokens());

        return result(sessionId, CompressionAction.TRUNCATE, before, after)
                .affectedMessages(cut.size())
                .truncationId(truncationId)
                .checkpoint(safety)
                .detail(detail)
                .build();
    }

    private SummaryResult requestSummary(List<Message> messages) throws InterruptedException {
        if (!summarizerPort.isAvailable()) {
            throw new SummarizationException("summarizer not available");
        }

        Duration timeout = properties.getSummarizer().getTimeout();
        long start = clock.millis();
        CompletableFuture<SummaryResult> future = summarizerPort.summarize(messages, HINT_PROMPT);
        try {
            SummaryResult summary = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (summary == null || !summary.hasText()) {
                throw new SummarizationException("summarizer returned an empty summary");
            }
            log.debug("[Compaction] Summarized {} messages in {}ms", messages.size(), clock.millis() - start);
            return summary;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SummarizationException("summarizer timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SummarizationException("summarizer failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new SummarizationException("summarizer call was cancelled", e);
        }
    }

    private Checkpoint safetyCheckpoint(String sessionId, CompressionAction action, ContextEngineConfig config) {
        if (!config.checkpointBeforeCompression()) {
            return null;
        }
        return checkpointService.create(sessionId, "Auto-before-" + action.value());
    }

    private void discardMemory(CompactedSession memory, StorageException cause) {
        try {
            midTermMemoryService.delete(memory.getId());
        } catch (StorageException e) {
            cause.addSuppressed(e);
            log.error("[Compaction] Failed to discard memory {} after failed compaction", memory.getId(), e);
        }
    }

    private boolean isPrunable(Message message, ContextEngineConfig config) {
        return message.isToolMessage() && !message.isPruned() && message.contentLength() > config.pruneMinChars();
    }

    private CompressionResult asRequested(CompressionResult pruneResult, boolean degraded, String detail) {
        return pruneResult.toBuilder()
                .requestedAction(CompressionAction.COMPACT)
                .degraded(degraded)
                .detail(detail)
                .build();
    }

    private CompressionResult cancelled(String sessionId, CompressionAction requested, TokenUsage usage) {
        return result(sessionId, requested, usage, usage)
                .appliedAction(CompressionAction.NONE)
                .cancelled(true)
                .detail("cancelled")
                .build();
    }

    private CompressionResult.CompressionResultBuilder result(String sessionId, CompressionAction action,
            TokenUsage before, TokenUsage after) {
        return CompressionResult.builder()
                .sessionId(sessionId)
                .requestedAction(action)
                .appliedAction(action)
                .usageBefore(before)
                .usageAfter(after)
                .savedTokens(Math.max(0, before.usedTokens() - after.usedTokens()));
    }
}
