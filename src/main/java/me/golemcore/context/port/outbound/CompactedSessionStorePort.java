package me.golemcore.context.port.outbound;

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

import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.domain.model.TierTransition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for mid-term and long-term memory records.
 *
 * <p>
 * Background jobs never hold a lock across a read and the following write.
 * Instead the conditional methods compare the record's {@code lastAccessedAt}
 * (and tier) with the value that was read, and report {@code false} if another
 * writer got there first.
 */
public interface CompactedSessionStorePort {

    void save(CompactedSession session);

    Optional<CompactedSession> findById(String id);

    List<CompactedSession> listBySession(String sessionId);

    List<CompactedSession> listByTier(MemoryTier tier);

    List<CompactedSession> listAll();

    /**
     * Mid-term records ordered by {@code accessCount DESC, lastAccessedAt ASC}.
     */
    List<CompactedSession> findForPromotion(int limit);

    /**
     * Increment {@code accessCount} and set {@code lastAccessedAt} for every
     * record of the session in one statement.
     *
     * @return number of records touched
     */
    int recordAccess(String sessionId, Instant accessedAt);

    /**
     * Move a mid-term record to {@code to} if it is still mid-term and was not
     * accessed since {@code expectedLastAccessedAt}.
     */
    boolean compareAndPromote(String id, Instant expectedLastAccessedAt, MemoryTier to, Instant at,
            List<TierTransition> promotionHistory);

    /**
     * Delete a mid-term record if it is still mid-term and unchanged since
     * {@code expectedLastAccessedAt}.
     */
    boolean deleteIfUnchanged(String id, Instant expectedLastAccessedAt);

    boolean delete(String id);

    long count(MemoryTier tier);
}
