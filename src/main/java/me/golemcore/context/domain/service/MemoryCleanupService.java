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
import me.golemcore.context.domain.model.CleanupReport;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryCleanupConfig;
import me.golemcore.context.domain.model.MemoryStats;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.port.outbound.CompactedSessionStorePort;
import me.golemcore.context.port.outbound.MessageStorePort;
import me.golemcore.context.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Expires stale mid-term memories and repairs inconsistencies between the
 * memory records, the transcript store and the vector store.
 *
 * <p>
 * The three passes are independent: a failing pass is reported in
 * {@link CleanupReport#errors()} and the others still run. Long-term records
 * are never expired; they are only removed once the conversation they came
 * from is gone.
 */
@Service
@Slf4j
public class MemoryCleanupService {

    static final String PASS_EXPIRY = "expiry";
    static final String PASS_DANGLING = "dangling";
    static final String PASS_ORPHANED = "orphaned";

    private final CompactedSessionStorePort store;
    private final MessageStorePort messageStore;
    private final VectorStorePort vectorStore;
    private final Clock clock;

    public MemoryCleanupService(CompactedSessionStorePort store, MessageStorePort messageStore,
            VectorStorePort vectorStore, Clock clock) {
        this.store = store;
        this.messageStore = messageStore;
        this.vectorStore = vectorStore;
        this.clock = clock;
    }

    public CleanupReport runCleanup(MemoryCleanupConfig config) {
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();

        int expired = runPass(PASS_EXPIRY, errors, () -> expireStale(config, now));
        int dangling = runPass(PASS_DANGLING, errors, this::removeDangling);
        int orphaned = runPass(PASS_ORPHANED, errors, this::removeOrphanedEmbeddings);

        CleanupReport report = new CleanupReport(expired, dangling, orphaned, errors);
        if (expired + dangling + orphaned > 0 || report.hasErrors()) {
            log.info("[Cleanup] Run finished: expired={}, dangling={}, orphaned={}, errors={}",
                    expired, dangling, orphaned, errors.size());
        } else {
            log.debug("[Cleanup] Nothing to clean up");
        }
        return report;
    }

    /**
     * What the next run would touch, without writing anything.
     */
    public MemoryStats stats(MemoryCleanupConfig config) {
        Instant now = clock.instant();
        int orphaned;
        try {
            orphaned = vectorStore.listOrphaned().size();
        } catch (RuntimeException e) { // NOSONAR - stats are informational
            log.warn("[Cleanup] Failed to list orphaned embeddings: {}", e.getMessage());
            orphaned = 0;
        }
        return MemoryStats.builder()
                .totalMidTerm(store.count(MemoryTier.MID_TERM))
                .totalLongTerm(store.count(MemoryTier.LONG_TERM))
                .expiredCandidates(findExpired(config, now).size())
                .danglingCandidates(findDangling().size())
                .orphanedCandidates(orphaned)
                .build();
    }

    private int runPass(String pass, List<String> errors, IntSupplier action) {
        try {
            return action.getAsInt();
        } catch (RuntimeException e) { // NOSONAR - one pass must not abort the others
            log.warn("[Cleanup] Pass '{}' failed: {}", pass, e.getMessage(), e);
            errors.add(pass + ": " + e.getMessage());
            return 0;
        }
    }

    private int expireStale(MemoryCleanupConfig config, Instant now) {
        int expired = 0;
        for (CompactedSession memory : findExpired(config, now)) {
            if (store.deleteIfUnchanged(memory.getId(), memory.getLastAccessedAt())) {
                expired++;
                log.debug("[Cleanup] Expired mid-term memory {} of session {}", memory.getId(),
                        memory.getSessionId());
            }
        }
        return expired;
    }

    private List<CompactedSession> findExpired(MemoryCleanupConfig config, Instant now) {
        Instant cutoff = now.minus(config.retentionDays(), ChronoUnit.DAYS);
        return store.listByTier(MemoryTier.MID_TERM).stream()
                .filter(memory -> memory.getAccessCount() < config.minAccessCount())
                .filter(memory -> {
                    Instant lastAccess = memory.getLastAccessedAt() != null ? memory.getLastAccessedAt()
                            : memory.getCreatedAt();
                    return lastAccess != null && lastAccess.isBefore(cutoff);
                })
                .toList();
    }

    private int removeDangling() {
        int removed = 0;
        for (CompactedSession memory : findDangling()) {
            if (!store.delete(memory.getId())) {
                continue;
            }
            removed++;
            log.info("[Cleanup] Removed dangling long-term memory {} (session {} is gone)", memory.getId(),
                    memory.getSessionId());
            try {
                vectorStore.deleteEmbedding(memory.getId());
            } catch (RuntimeException e) { // NOSONAR - the orphan pass picks it up
                log.warn("[Cleanup] Failed to delete embedding of memory {}: {}", memory.getId(), e.getMessage());
            }
        }
        return removed;
    }

    private List<CompactedSession> findDangling() {
        return store.listByTier(MemoryTier.LONG_TERM).stream()
                .filter(this::isDangling)
                .toList();
    }

    private boolean isDangling(CompactedSession memory) {
        if (messageStore.countByConversation(memory.getSessionId()) == 0) {
            return true;
        }
        List<String> range = new ArrayList<>(2);
        if (memory.getMessageStart() != null) {
            range.add(memory.getMessageStart());
        }
        if (memory.getMessageEnd() != null) {
            range.add(memory.getMessageEnd());
        }
        return !range.isEmpty() && !messageStore.existsAll(range);
    }

    private int removeOrphanedEmbeddings() {
        List<String> orphaned = vectorStore.listOrphaned();
        for (String id : orphaned) {
            vectorStore.deleteEmbedding(id);
        }
        if (!orphaned.isEmpty()) {
            log.info("[Cleanup] Deleted {} orphaned embeddings", orphaned.size());
        }
        return orphaned.size();
    }
}
