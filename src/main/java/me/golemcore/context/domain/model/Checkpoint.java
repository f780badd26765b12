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

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, named snapshot of a full transcript, including messages that
 * compression already took out of the active set.
 */
@Builder
public record Checkpoint(String id, String sessionId, String name, int messageCount, long tokenCount,
        String summary, List<Message> messagesSnapshot, Instant createdAt) {

    public Checkpoint {
        messagesSnapshot = messagesSnapshot != null
                ? messagesSnapshot.stream().map(message -> message.toBuilder().build()).toList()
                : List.of();
    }

    /**
     * Fresh copies of the snapshot messages, so the checkpoint itself can never be
     * changed through them.
     */
    @Override
    public List<Message> messagesSnapshot() {
        return messagesSnapshot.stream()
                .map(message -> message.toBuilder().build())
                .toList();
    }

    public List<Message> copyMessages() {
        return messagesSnapshot();
    }
}
