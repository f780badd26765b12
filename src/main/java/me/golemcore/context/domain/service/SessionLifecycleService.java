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
import me.golemcore.context.domain.model.SessionDeletion;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Removes a conversation together with its checkpoints and mid-term memories.
 * Long-term memories are kept; cleanup removes them once it finds them
 * dangling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {

    private final ContextSessionCoordinator coordinator;
    private final MessageStorePort messageStore;
    private final CheckpointService checkpointService;
    private final MidTermMemoryService midTermMemoryService;

    public CompletableFuture<SessionDeletion> deleteSession(String sessionId) {
        coordinator.cancel(sessionId);
        return coordinator.submit(sessionId, "delete", () -> {
            int checkpoints = checkpointService.deleteBySession(sessionId);
            int memories = midTermMemoryService.deleteMidTermBySession(sessionId);
            int messages = messageStore.deleteByConversation(sessionId);
            log.info("[Session] Deleted session {}: {} messages, {} checkpoints, {} mid-term memories",
                    sessionId, messages, checkpoints, memories);
            return new SessionDeletion(sessionId, messages, checkpoints, memories);
        });
    }
}
