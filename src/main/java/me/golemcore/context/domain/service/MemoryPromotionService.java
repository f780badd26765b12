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
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryAutoUpgradeConfig;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.domain.model.PromotionReport;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.CompactedSessionStorePort;
import me.golemcore.context.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Promotes eligible mid-term memories to long-term.
 *
 * <p>
 * A candidate is eligible when it was accessed at least
 * {@code minAccessCount} times and has not been accessed for
 * {@code daysThreshold} days. The tier write is conditional on the record being
 * unchanged since it was read, so a concurrent access simply defers the
 * promotion to the next run.
 *
 * <p>
 * After the tier change an embedding of the summary is requested. Embedding
 * failures never undo a promotion; they are counted in the report.
 */
@Service
@Slf4j
public class MemoryPromotionService {

    private final MidTermMemoryService memoryService;
    private final CompactedSessionStorePort store;
    private final VectorStorePort vectorStore;
    private final EngineProperties properties;
    private final Clock clock;

    public MemoryPromotionService(MidTermMemoryService memoryService, CompactedSessionStorePort store,
            VectorStorePort vectorStore, EngineProperties properties, Clock clock) {
        this.memoryService = memoryService;
        this.store = store;
        this.vectorStore = vectorStore;
        this.properties = properties;
        this.clock = clock;
    }

    public PromotionReport runPromotion(MemoryAutoUpgradeConfig config) {
        if (!config.enabled()) {
            log.debug("[Promotion] Auto-upgrade disabled, skipping");
            return PromotionReport.disabled();
        }

        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();
        List<CompactedSession> candidates;
        try {
            candidates = memoryService.getMemoriesForPromotion(config.batchSize());
        } catch (StorageException e) {
            log.warn("[Promotion] Failed to load candidates: {}", e.getMessage());
            return PromotionReport.builder().errors(List.of("candidates: " + e.getMessage())).build();
        }

        int promoted = 0;
        int skipped = 0;
        Map<String, CompletableFuture<Void>> embeddings = new LinkedHashMap<>();
        List<String> embeddingErrors = new ArrayList<>();
        for (CompactedSession candidate : candidates) {
            if (!isEligible(candidate, config, now)) {
                skipped++;
                continue;
            }
            try {
                if (promote(candidate, now)) {
                    promoted++;
                    requestEmbedding(candidate, embeddings, embeddingErrors);
                } else {
                    skipped++;
                }
            } catch (StorageException e) {
                log.warn("[Promotion] Failed to promote memory {}: {}", candidate.getId(), e.getMessage());
                errors.add(candidate.getId() + ": " + e.getMessage());
            }
        }

        collectEmbeddingFailures(embeddings, embeddingErrors);
        errors.addAll(embeddingErrors);

        PromotionReport report = PromotionReport.builder()
                .candidates(candidates.size())
                .promoted(promoted)
                .skipped(skipped)
                .embeddingFailures(embeddingErrors.size())
                .errors(errors)
                .build();
        if (promoted > 0 || !errors.isEmpty()) {
            log.info("[Promotion] Run finished: {} candidates, {} promoted, {} skipped, {} errors",
                    report.candidates(), report.promoted(), report.skipped(), report.errors().size());
        }
        return report;
    }

    public boolean isEligible(CompactedSession memory, MemoryAutoUpgradeConfig config, Instant now) {
        if (!config.enabled() || !memory.isMidTerm()) {
            return false;
        }
        if (memory.getAccessCount() < config.minAccessCount()) {
            return false;
        }
        Instant lastAccess = memory.getLastAccessedAt() != null ? memory.getLastAccessedAt()
                : memory.getCreatedAt();
        if (lastAccess == null) {
            return false;
        }
        return Duration.between(lastAccess, now).toDays() >= config.daysThreshold();
    }

    private boolean promote(CompactedSession candidate, Instant now) {
        Instant expectedLastAccess = candidate.getLastAccessedAt();
        candidate.promote(now);
        boolean updated = store.compareAndPromote(candidate.getId(), expectedLastAccess, MemoryTier.LONG_TERM,
                now, candidate.getPromotionHistory());
        if (!updated) {
            log.debug("[Promotion] Memory {} changed since it was read, deferring", candidate.getId());
            return false;
        }
        log.info("[Promotion] Memory {} of session {} promoted to long-term (accessCount={})",
                candidate.getId(), candidate.getSessionId(), candidate.getAccessCount());
        return true;
    }

    private void requestEmbedding(CompactedSession memory, Map<String, CompletableFuture<Void>> embeddings,
            List<String> embeddingErrors) {
        try {
            embeddings.put(memory.getId(), vectorStore.upsertEmbedding(memory.getId(), memory.getSummary()));
        } catch (RuntimeException e) { // NOSONAR - embedding is best-effort
            log.warn("[Promotion] Embedding request for memory {} failed: {}", memory.getId(), e.getMessage());
            embeddingErrors.add("embedding " + memory.getId() + ": " + e.getMessage());
        }
    }

    private void collectEmbeddingFailures(Map<String, CompletableFuture<Void>> embeddings,
            List<String> embeddingErrors) {
        if (embeddings.isEmpty()) {
            return;
        }

        Duration wait = properties.getScheduler().getEmbeddingWait();
        try {
            CompletableFuture.allOf(embeddings.values().toArray(new CompletableFuture<?>[0]))
                    .get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[Promotion] Not all embeddings succeeded in time: {}", e.getMessage());
        }

        int pending = 0;
        for (Map.Entry<String, CompletableFuture<Void>> entry : embeddings.entrySet()) {
            CompletableFuture<Void> future = entry.getValue();
            if (!future.isDone()) {
                pending++;
                continue;
            }
            try {
                future.getNow(null);
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Promotion] Embedding of memory {} failed: {}", entry.getKey(), cause.getMessage());
                embeddingErrors.add("embedding " + entry.getKey() + ": " + cause.getMessage());
            }
        }
        if (pending > 0) {
            log.info("[Promotion] {} embeddings still running after {}ms", pending, wait.toMillis());
        }
    }
}
