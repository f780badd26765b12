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
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.port.outbound.CompactedSessionStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Access layer over the compacted-session records written by compaction.
 *
 * <p>
 * Access statistics drive promotion: every time the retrieval side injects a
 * session's memories into a prompt it must go through
 * {@link #retrieveForPrompt(String)} or {@link #recordAccess(String)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MidTermMemoryService {

    static final int DEFAULT_PROMOTION_LIMIT = 10;

    private final CompactedSessionStorePort store;
    private final Clock clock;

    public CompactedSession create(String sessionId, String summary, List<String> keyTopics,
            List<String> decisions, String messageStart, String messageEnd, int messageCount) {
        Instant now = clock.instant();
        CompactedSession memory = CompactedSession.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .summary(summary)
                .keyTopics(new ArrayList<>(keyTopics))
                .decisions(new ArrayList<>(decisions))
                .messageStart(messageStart)
                .messageEnd(messageEnd)
                .messageCount(messageCount)
                .createdAt(now)
                .lastAccessedAt(now)
                .accessCount(0)
                .tier(MemoryTier.MID_TERM)
                .tierUpdatedAt(now)
                .build();
        store.save(memory);
        log.info("[Memory] Stored mid-term memory {} for session {} ({} topics, {} decisions)",
                memory.getId(), sessionId, keyTopics.size(), decisions.size());
        return memory;
    }

    public Optional<CompactedSession> get(String id) {
        return store.findById(id);
    }

    public List<CompactedSession> listBySession(String sessionId) {
        return store.listBySession(sessionId);
    }

    public List<CompactedSession> listByTier(MemoryTier tier) {
        return store.listByTier(tier);
    }

    public List<CompactedSession> listAll() {
        return store.listAll();
    }

    /**
     * Mid-term records, most accessed first and, among equals, the longest
     * untouched first.
     */
    public List<CompactedSession> getMemoriesForPromotion(int limit) {
        return store.findForPromotion(limit > 0 ? limit : DEFAULT_PROMOTION_LIMIT);
    }

    public int recordAccess(String sessionId) {
        int touched = store.recordAccess(sessionId, clock.instant());
        log.debug("[Memory] Recorded access to {} memories of session {}", touched, sessionId);
        return touched;
    }

    /**
     * Memories of a session for prompt injection; counts as an access.
     */
    public List<CompactedSession> retrieveForPrompt(String sessionId) {
        if (recordAccess(sessionId) == 0) {
            return List.of();
        }
        return store.listBySession(sessionId);
    }

    public boolean delete(String id) {
        return store.delete(id);
    }

    /**
     * Delete the session's mid-term records. Long-term records outlive their
     * session until cleanup finds them dangling.
     */
    public int deleteMidTermBySession(String sessionId) {
        int deleted = 0;
        for (CompactedSession memory : store.listBySession(sessionId)) {
            if (memory.isMidTerm() && store.delete(memory.getId())) {
                deleted++;
            }
        }
        return deleted;
    }

    public long count(MemoryTier tier) {
        return store.count(tier);
    }
}
