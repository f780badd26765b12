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

import me.golemcore.context.domain.model.Message;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port for transcript message persistence.
 *
 * <p>
 * Listings are ordered by timestamp, insertion order breaking ties. Batch
 * operations run in a single transaction: either every row is written or none.
 * Failures surface as {@link me.golemcore.context.domain.exception.StorageException}.
 */
public interface MessageStorePort {

    void append(Message message);

    /**
     * Full history of a conversation, including condensed and truncated
     * messages.
     */
    List<Message> listByConversation(String conversationId);

    /**
     * Messages still in the active set.
     */
    List<Message> listActive(String conversationId);

    /**
     * Update existing messages in one transaction, optionally inserting new ones
     * in the same transaction. Only the compression state, {@code replacedBy},
     * {@code pruned} and a first {@code checkpointId} are written for existing
     * messages; content and token count stay as appended.
     */
    void updateAll(List<Message> updated, List<Message> inserted);

    int countByConversation(String conversationId);

    Optional<Instant> findLatestTimestamp(String conversationId);

    boolean existsAll(Collection<String> ids);

    int deleteByConversation(String conversationId);
}
