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
import me.golemcore.context.domain.model.AppendOutcome;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.CompressionResult;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.TokenUsage;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serializes transcript mutations per session.
 *
 * <p>
 * Every session has a single-writer queue. Appends, manual compression and
 * checkpoint operations are submitted to it and run one at a time on the shared
 * {@code sessionTaskExecutor}, so different sessions proceed in parallel while
 * the tasks of one session never overlap.
 *
 * <p>
 * {@link #cancel(String)} interrupts the running task of a session. A
 * compaction waiting for its summary ends without writing anything.
 */
@Service
@Slf4j
public class ContextSessionCoordinator {

    private final MessageStorePort messageStore;
    private final TokenBudgetEvaluator evaluator;
    private final CompressionEngine compressionEngine;
    private final CheckpointService checkpointService;
    private final EngineSettingsService settingsService;
    private final ExecutorService sessionTaskExecutor;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<String, SessionWorker> workers = new ConcurrentHashMap<>();

    public ContextSessionCoordinator(MessageStorePort messageStore, TokenBudgetEvaluator evaluator,
            CompressionEngine compressionEngine, CheckpointService checkpointService,
            EngineSettingsService settingsService, ExecutorService sessionTaskExecutor,
            EngineProperties properties, Clock clock) {
        this.messageStore = messageStore;
        this.evaluator = evaluator;
        this.compressionEngine = compressionEngine;
        this.checkpointService = checkpointService;
        this.settingsService = settingsService;
        this.sessionTaskExecutor = sessionTaskExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Store a message, then run the compression pass and the automatic
     * checkpoint it triggers.
     */
    public CompletableFuture<AppendOutcome> append(String sessionId, Message message) {
        Objects.requireNonNull(message, "message");
        return submit(sessionId, "append", () -> appendAndCompress(sessionId, message));
    }

    /**
     * Run a compression pass. {@link CompressionAction#NONE} lets the evaluator
     * decide.
     */
    public CompletableFuture<CompressionResult> compress(String sessionId, CompressionAction action) {
        return submit(sessionId, "compress", () -> {
            ContextEngineConfig config = settingsService.getContextConfig();
            CompressionAction effective = action != CompressionAction.NONE ? action
                    : evaluator.evaluate(messageStore.listActive(sessionId), config);
            return compressionEngine.apply(sessionId, effective, config);
        });
    }

    public CompletableFuture<Checkpoint> checkpoint(String sessionId, String name) {
        return submit(sessionId, "checkpoint", () -> checkpointService.create(sessionId, name));
    }

    /**
     * Queue a task behind the session's other tasks.
     */
    public <T> CompletableFuture<T> submit(String sessionId, String label, Callable<T> work) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionTask<T> task = new SessionTask<>(label, work);
        while (true) {
            SessionWorker worker = workers.computeIfAbsent(sessionId, SessionWorker::new);
            if (worker.enqueue(task)) {
                return task.result;
            }
            // worker was evicted between lookup and enqueue
            workers.remove(sessionId, worker);
        }
    }

    /**
     * Interrupt the task currently running for the session. Queued tasks are
     * kept.
     *
     * @return whether a running task was signalled
     */
    public boolean cancel(String sessionId) {
        SessionWorker worker = workers.get(sessionId);
        boolean cancelled = worker != null && worker.cancelRunning();
        log.info("[SessionCoordinator] cancel requested for session {} (cancelled={})", sessionId, cancelled);
        return cancelled;
    }

    public boolean isBusy(String sessionId) {
        SessionWorker worker = workers.get(sessionId);
        return worker != null && worker.isBusy();
    }

    private AppendOutcome appendAndCompress(String sessionId, Message inbound) {
        ContextEngineConfig config = settingsService.getContextConfig();
        Message stored = prepareForAppend(sessionId, inbound);
        messageStore.append(stored);

        TokenUsage usage = evaluator.measure(messageStore.listActive(sessionId), config);
        CompressionAction action = evaluator.decide(usage, config);
        CompressionResult compression = action == CompressionAction.NONE
                ? CompressionResult.none(sessionId, usage)
                : compressionEngine.apply(sessionId, action, config);
        if (compression.cancelled()) {
            return new AppendOutcome(stored, compression, null);
        }

        Checkpoint autoCheckpoint = null;
        int messageCount = messageStore.countByConversation(sessionId);
        if (checkpointService.shouldAutoCheckpoint(sessionId, messageCount, config)) {
            autoCheckpoint = checkpointService.createAutomatic(sessionId, messageCount);
        }
        return new AppendOutcome(stored, compression, autoCheckpoint);
    }

    private Message prepareForAppend(String sessionId, Message inbound) {
        Message message = inbound.toBuilder()
                .id(inbound.getId() != null ? inbound.getId() : UUID.randomUUID().toString())
                .conversationId(sessionId)
                .build();
        if (message.getTokenCount() == null) {
            message.setTokenCount(evaluator.estimateTokens(message.getContent()));
        }

        Instant timestamp = (message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                .truncatedTo(ChronoUnit.MILLIS);
        Optional<Instant> latest = messageStore.findLatestTimestamp(sessionId);
        if (latest.isPresent() && !timestamp.isAfter(latest.get())) {
            timestamp = latest.get().plusMillis(1);
        }
        message.setTimestamp(timestamp);
        return message;
    }

    private static final class SessionTask<T> {

        private final String label;
        private final Callable<T> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private Thread thread;
        private boolean cancelRequested;

        private SessionTask(String label, Callable<T> work) {
            this.label = label;
            this.work = work;
        }
    }

    private final class SessionWorker {

        private final String sessionId;
        private final Object lock = new Object();
        private final Deque<SessionTask<?>> queue = new ArrayDeque<>();

        private SessionTask<?> current;
        private boolean evicted;

        private SessionWorker(String sessionId) {
            this.sessionId = sessionId;
        }

        boolean enqueue(SessionTask<?> task) {
            synchronized (lock) {
                if (evicted) {
                    return false;
                }
                if (current != null) {
                    int limit = properties.getSession().getMaxQueuedTasks();
                    if (queue.size() >= limit) {
                        log.warn("[SessionCoordinator] queue limit reached ({}), rejecting {} for session {}",
                                limit, task.label, sessionId);
                        task.result.completeExceptionally(new IllegalStateException(
                                "Too many pending operations for session " + sessionId));
                        return true;
                    }
                    queue.addLast(task);
                    return true;
                }
                startLocked(task);
                return true;
            }
        }

        boolean cancelRunning() {
            synchronized (lock) {
                if (current == null) {
                    return false;
                }
                current.cancelRequested = true;
                if (current.thread != null) {
                    current.thread.interrupt();
                }
                return true;
            }
        }

        boolean isBusy() {
            synchronized (lock) {
                return current != null || !queue.isEmpty();
            }
        }

        private void startLocked(SessionTask<?> task) {
            current = task;
            try {
                sessionTaskExecutor.execute(() -> run(task));
            } catch (RejectedExecutionException e) {
                current = null;
                task.result.completeExceptionally(e);
                log.error("[SessionCoordinator] executor rejected {} for session {}", task.label, sessionId);
            }
        }

        private <T> void run(SessionTask<T> task) {
            try {
                synchronized (lock) {
                    if (task.cancelRequested) {
                        task.result.completeExceptionally(new CancellationException("cancelled before start"));
                        return;
                    }
                    task.thread = Thread.currentThread();
                }
                task.result.complete(task.work.call());
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                handleFailure(task, e);
            } finally {
                synchronized (lock) {
                    task.thread = null;
                }
                // drop an interrupt aimed at this task before the thread is reused
                Thread.interrupted();
                onTaskComplete();
            }
        }

        private void handleFailure(SessionTask<?> task, Exception e) {
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                log.info("[SessionCoordinator] {} interrupted for session {}", task.label, sessionId);
                task.result.completeExceptionally(new CancellationException(task.label + " interrupted"));
                return;
            }
            log.error("[SessionCoordinator] {} failed for session {}: {}", task.label, sessionId, e.getMessage(), e);
            task.result.completeExceptionally(e);
        }

        private void onTaskComplete() {
            synchronized (lock) {
                current = null;
                SessionTask<?> next = queue.pollFirst();
                if (next != null) {
                    startLocked(next);
                    return;
                }
                evicted = true;
            }
            workers.remove(sessionId, this);
            log.debug("[SessionCoordinator] evicted idle worker for session {}", sessionId);
        }
    }
}
