package me.golemcore.context.domain.service;

import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.CompressionResult;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SummaryResult;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.SummarizerPort;
import me.golemcore.context.testsupport.InMemoryContextStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.context.testsupport.TestMessages.assistant;
import static me.golemcore.context.testsupport.TestMessages.tool;
import static me.golemcore.context.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("PMD.TooManyMethods")
class CompressionEngineTest {

    private static final String SESSION = "s1";
    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

    private InMemoryContextStore store;
    private SummarizerPort summarizer;
    private TokenBudgetEvaluator evaluator;
    private CompressionEngine engine;
    private ContextEngineConfig config;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        summarizer = mock(SummarizerPort.class);
        when(summarizer.isAvailable()).thenReturn(true);
        evaluator = new TokenBudgetEvaluator();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        EngineProperties properties = new EngineProperties();
        properties.getSummarizer().setTimeout(Duration.ofMillis(200));

        CheckpointService checkpointService = new CheckpointService(store.messages(), store.checkpoints(),
                evaluator, clock);
        MidTermMemoryService memoryService = new MidTermMemoryService(store.memories(), clock);
        engine = new CompressionEngine(store.messages(), summarizer, evaluator,
                new CompactionPreparationService(), new HeuristicMemoryExtractor(), memoryService,
                checkpointService, properties, clock);

        config = ContextEngineConfig.defaults().toBuilder()
                .maxTokens(10_000)
                .modelContextLimit(10_000)
                .modelOutputLimit(0)
                .messagesToKeep(2)
                .pruneMinChars(100)
                .build();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldPruneOldLargeToolOutputsOnly() {
        append(user(SESSION, 1, "run it", 10),
                tool(SESSION, 2, "x".repeat(1000), 250),
                tool(SESSION, 3, "short", 2),
                user(SESSION, 4, "again", 10),
                tool(SESSION, 5, "y".repeat(1000), 250));

        CompressionResult result = engine.prune(SESSION, config);

        assertEquals(CompressionAction.PRUNE, result.appliedAction());
        assertEquals(1, result.affectedMessages());
        Message pruned = store.messages().get("s1-m2");
        assertTrue(pruned.isPruned());
        assertEquals("[Tool output pruned: 1000 chars]", pruned.getEffectiveContent());
        assertEquals(evaluator.estimateTokens(pruned.getEffectiveContent()), evaluator.tokensOf(pruned));
        assertTrue(pruned.isActive());
        assertEquals("short", store.messages().get("s1-m3").getContent());
        assertEquals("y".repeat(1000), store.messages().get("s1-m5").getContent());
        assertEquals(result.usageBefore().usedTokens() - result.usageAfter().usedTokens(), result.savedTokens());
    }

    @Test
    void shouldKeepStoredPayloadWhenPruning() {
        String payload = "{\"rows\": [" + "1, ".repeat(330) + "1]}";
        append(user(SESSION, 1, "dump the table", 10),
                tool(SESSION, 2, payload, 300),
                user(SESSION, 3, "thanks", 10),
                assistant(SESSION, 4, "done", 10));
        Map<String, String> before = storedContents();

        engine.prune(SESSION, config);

        assertEquals(before, storedContents());
        Message pruned = store.messages().get("s1-m2");
        assertTrue(pruned.isPruned());
        assertEquals(payload, pruned.getContent());
        assertEquals(300, pruned.getTokenCount());
        assertEquals("[Tool output pruned: " + payload.length() + " chars]", pruned.getEffectiveContent());
    }

    @Test
    void shouldNotWriteOnSecondPrune() {
        append(tool(SESSION, 1, "x".repeat(1000), 250),
                user(SESSION, 2, "u", 10),
                assistant(SESSION, 3, "a", 10));
        engine.prune(SESSION, config);
        int updates = store.messages().updateCount();

        CompressionResult second = engine.prune(SESSION, config);

        assertEquals(0, second.affectedMessages());
        assertEquals(updates, store.messages().updateCount());
    }

    @Test
    void shouldCompactOldMessagesIntoSummaryAndMemory() {
        append(user(SESSION, 1, "Let's fix the Docker config", 100),
                assistant(SESSION, 2, "Looking at it", 100),
                user(SESSION, 3, "And the ports?", 100),
                assistant(SESSION, 4, "Mapped 8080", 100),
                user(SESSION, 5, "Thanks", 100),
                assistant(SESSION, 6, "Anytime", 100));
        when(summarizer.summarize(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                new SummaryResult("  They fixed the config.  ", List.of(), List.of("use compose"))));

        CompressionResult result = engine.compact(SESSION, config);

        assertEquals(CompressionAction.COMPACT, result.appliedAction());
        assertFalse(result.degraded());
        assertEquals(4, result.affectedMessages());
        Message summary = result.summaryMessage();
        assertEquals("[Conversation summary]\nThey fixed the config.", summary.getContent());

        List<Message> active = store.messages().listActive(SESSION);
        assertEquals(List.of(summary.getId(), "s1-m5", "s1-m6"), active.stream().map(Message::getId).toList());
        assertTrue(active.get(0).isSummary());
        for (int i = 1; i <= 4; i++) {
            assertEquals(summary.getCondenseId(), store.messages().get("s1-m" + i).getCondenseParent());
        }

        List<CompactedSession> memories = store.memories().listBySession(SESSION);
        assertEquals(1, memories.size());
        CompactedSession memory = memories.get(0);
        assertEquals("They fixed the config.", memory.getSummary());
        assertEquals("s1-m1", memory.getMessageStart());
        assertEquals("s1-m4", memory.getMessageEnd());
        assertEquals(4, memory.getMessageCount());
        assertEquals(List.of("use compose"), memory.getDecisions());
        assertTrue(memory.getKeyTopics().contains("Docker"));
        assertEquals(NOW, memory.getLastAccessedAt());
        assertEquals(0, memory.getAccessCount());
    }

    @Test
    void shouldTakeSafetyCheckpointBeforeCompaction() {
        append(user(SESSION, 1, "one", 100), assistant(SESSION, 2, "two", 100), user(SESSION, 3, "three", 100));
        when(summarizer.summarize(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                new SummaryResult("summary", List.of(), List.of())));

        CompressionResult result = engine.compact(SESSION, config);

        Checkpoint checkpoint = result.checkpoint();
        assertNotNull(checkpoint);
        assertEquals("Auto-before-compact", checkpoint.name());
        assertEquals(3, checkpoint.messageCount());
        assertTrue(checkpoint.messagesSnapshot().stream().allMatch(Message::isActive));
        assertEquals(checkpoint.id(), store.messages().get("s1-m1").getCheckpointId());
        assertNull(store.messages().get(result.summaryMessage().getId()).getCheckpointId());
    }

    @Test
    void shouldFallBackToPruneWhenSummarizerFails() {
        append(tool(SESSION, 1, "x".repeat(1000), 250),
                user(SESSION, 2, "u", 10),
                assistant(SESSION, 3, "a", 10),
                user(SESSION, 4, "u", 10));
        when(summarizer.summarize(anyList(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        CompressionResult result = engine.compact(SESSION, config);

        assertEquals(CompressionAction.COMPACT, result.requestedAction());
        assertEquals(CompressionAction.PRUNE, result.appliedAction());
        assertTrue(result.degraded());
        assertTrue(result.detail().contains("boom"));
        assertEquals(1, result.affectedMessages());
        assertNull(result.summaryMessage());
        assertTrue(store.memories().listAll().isEmpty());
        assertTrue(store.checkpoints().all().isEmpty());
        assertEquals(4, store.messages().listActive(SESSION).size());
    }

    @Test
    void shouldFallBackToPruneWhenSummarizerUnavailable() {
        when(summarizer.isAvailable()).thenReturn(false);
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10), user(SESSION, 3, "u", 10));

        CompressionResult result = engine.compact(SESSION, config);

        assertTrue(result.degraded());
        assertEquals(CompressionAction.PRUNE, result.appliedAction());
        verify(summarizer, never()).summarize(anyList(), anyString());
    }

    @Test
    void shouldFallBackToPruneAndCancelCallOnTimeout() {
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10), user(SESSION, 3, "u", 10));
        CompletableFuture<SummaryResult> pending = new CompletableFuture<>();
        when(summarizer.summarize(anyList(), anyString())).thenReturn(pending);

        CompressionResult result = engine.compact(SESSION, config);

        assertTrue(result.degraded());
        assertTrue(result.detail().contains("timed out"));
        assertTrue(pending.isCancelled());
        assertTrue(store.memories().listAll().isEmpty());
    }

    @Test
    void shouldTreatBlankSummaryAsFailure() {
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10), user(SESSION, 3, "u", 10));
        when(summarizer.summarize(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                new SummaryResult("   ", List.of(), List.of())));

        CompressionResult result = engine.compact(SESSION, config);

        assertTrue(result.degraded());
        assertTrue(store.memories().listAll().isEmpty());
    }

    @Test
    void shouldEndCancelledWithoutWritesWhenInterrupted() {
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10), user(SESSION, 3, "u", 10));
        CompletableFuture<SummaryResult> pending = new CompletableFuture<>();
        when(summarizer.summarize(anyList(), anyString())).thenReturn(pending);

        Thread.currentThread().interrupt();
        CompressionResult result = engine.compact(SESSION, config);

        assertTrue(result.cancelled());
        assertEquals(CompressionAction.NONE, result.appliedAction());
        assertTrue(pending.isCancelled());
        assertEquals(0, store.messages().updateCount());
        assertTrue(store.memories().listAll().isEmpty());
        assertTrue(store.checkpoints().all().isEmpty());
    }

    @Test
    void shouldDiscardMemoryWhenTranscriptUpdateFails() {
        ContextEngineConfig noCheckpoint = config.toBuilder().checkpointBeforeCompression(false).build();
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10), user(SESSION, 3, "u", 10));
        when(summarizer.summarize(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                new SummaryResult("summary", List.of(), List.of())));
        store.messages().failNextUpdate();

        assertThrows(StorageException.class, () -> engine.compact(SESSION, noCheckpoint));

        assertTrue(store.memories().listAll().isEmpty());
        assertEquals(3, store.messages().listActive(SESSION).size());
    }

    @Test
    void shouldPruneWithoutDegradingWhenNothingIsOldEnough() {
        append(user(SESSION, 1, "u", 10), assistant(SESSION, 2, "a", 10));

        CompressionResult result = engine.compact(SESSION, config);

        assertEquals(CompressionAction.COMPACT, result.requestedAction());
        assertEquals(CompressionAction.PRUNE, result.appliedAction());
        assertFalse(result.degraded());
        verify(summarizer, never()).summarize(anyList(), anyString());
    }

    @Test
    void shouldTruncateOldestUntilBelowCompactThreshold() {
        append(user(SESSION, 1, "u1", 3000),
                assistant(SESSION, 2, "a2", 3000),
                user(SESSION, 3, "u3", 2000),
                assistant(SESSION, 4, "a4", 1000),
                user(SESSION, 5, "u5", 500));

        CompressionResult result = engine.truncate(SESSION, config);

        assertEquals(CompressionAction.TRUNCATE, result.appliedAction());
        assertEquals(1, result.affectedMessages());
        assertEquals(9500, result.usageBefore().usedTokens());
        assertEquals(6500, result.usageAfter().usedTokens());
        Message cut = store.messages().get("s1-m1");
        assertTrue(cut.isTruncationMarker());
        assertEquals(result.truncationId(), cut.getTruncationId());
        assertEquals("Auto-before-truncate", result.checkpoint().name());
        assertEquals(4, store.messages().listActive(SESSION).size());
    }

    @Test
    void shouldAddOnlySummaryMessageWhenCompacting() {
        append(user(SESSION, 1, "Let's fix the Docker config", 100),
                tool(SESSION, 2, "z".repeat(500), 100),
                assistant(SESSION, 3, "Looking at it", 100),
                user(SESSION, 4, "Thanks", 100),
                assistant(SESSION, 5, "Anytime", 100));
        when(summarizer.summarize(anyList(), anyString())).thenReturn(CompletableFuture.completedFuture(
                new SummaryResult("Docker config fixed.", List.of(), List.of())));
        Map<String, String> before = storedContents();

        CompressionResult result = engine.compact(SESSION, config);

        Map<String, String> after = storedContents();
        assertEquals(before.size() + 1, after.size());
        before.forEach((id, content) -> assertEquals(content, after.get(id)));
        assertEquals(result.summaryMessage().getContent(), after.get(result.summaryMessage().getId()));
    }

    @Test
    void shouldKeepEveryStoredMessageWhenTruncating() {
        append(user(SESSION, 1, "u1", 3000),
                assistant(SESSION, 2, "a2", 3000),
                user(SESSION, 3, "u3", 2000),
                assistant(SESSION, 4, "a4", 1000),
                user(SESSION, 5, "u5", 500));
        Map<String, String> before = storedContents();

        engine.truncate(SESSION, config);

        assertEquals(before, storedContents());
        assertEquals(4, store.messages().listActive(SESSION).size());
    }

    @Test
    void shouldTruncateToolResultTogetherWithItsCall() {
        append(assistant(SESSION, 1, "calling", 3000),
                tool(SESSION, 2, "result", 1000),
                user(SESSION, 3, "u3", 3000),
                assistant(SESSION, 4, "a4", 1500),
                user(SESSION, 5, "u5", 1000));

        CompressionResult result = engine.truncate(SESSION, config);

        assertEquals(2, result.affectedMessages());
        assertEquals(result.truncationId(), store.messages().get("s1-m2").getTruncationId());
        assertTrue(store.messages().get("s1-m3").isActive());
    }

    @Test
    void shouldNeverTruncateProtectedTail() {
        append(user(SESSION, 1, "u1", 100),
                assistant(SESSION, 2, "a2", 5000),
                user(SESSION, 3, "u3", 4500));

        CompressionResult result = engine.truncate(SESSION, config);

        assertEquals(1, result.affectedMessages());
        assertTrue(store.messages().get("s1-m2").isActive());
        assertTrue(store.messages().get("s1-m3").isActive());
        assertEquals("recent messages alone exceed the compact threshold", result.detail());
    }

    @Test
    void shouldReportNothingToTruncateForShortTranscript() {
        append(user(SESSION, 1, "u1", 5000), assistant(SESSION, 2, "a2", 5000));

        CompressionResult result = engine.truncate(SESSION, config);

        assertEquals(0, result.affectedMessages());
        assertNull(result.checkpoint());
        assertTrue(store.checkpoints().all().isEmpty());
    }

    @Test
    void shouldMeasureOnlyForNoneAction() {
        append(user(SESSION, 1, "u1", 100));

        CompressionResult result = engine.apply(SESSION, CompressionAction.NONE, config);

        assertEquals(CompressionAction.NONE, result.appliedAction());
        assertEquals(100, result.usageBefore().usedTokens());
        assertEquals(0, store.messages().updateCount());
    }

    private Map<String, String> storedContents() {
        Map<String, String> contents = new LinkedHashMap<>();
        for (Message message : store.messages().listByConversation(SESSION)) {
            contents.put(message.getId(), message.getContent());
        }
        return contents;
    }

    private void append(Message... messages) {
        for (Message message : messages) {
            store.messages().append(message);
        }
    }
}
