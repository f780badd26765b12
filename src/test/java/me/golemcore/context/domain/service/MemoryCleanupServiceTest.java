package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.CleanupReport;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryCleanupConfig;
import me.golemcore.context.domain.model.MemoryStats;
import me.golemcore.context.port.outbound.VectorStorePort;
import me.golemcore.context.testsupport.InMemoryContextStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static me.golemcore.context.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryCleanupServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");
    private static final MemoryCleanupConfig CONFIG = new MemoryCleanupConfig(30, 3);

    private InMemoryContextStore store;
    private VectorStorePort vectorStore;
    private MemoryCleanupService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        vectorStore = mock(VectorStorePort.class);
        when(vectorStore.listOrphaned()).thenReturn(List.of());
        service = new MemoryCleanupService(store.memories(), store.messages(), vectorStore,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReportZeroWhenNothingToClean() {
        CleanupReport report = service.runCleanup(CONFIG);

        assertEquals(new CleanupReport(0, 0, 0, List.of()), report);
        verify(vectorStore, never()).deleteEmbedding(anyString());
    }

    @Test
    void shouldExpireOnlyStaleRarelyUsedMidTermMemories() {
        store.memories().save(midTerm("stale", "s1", 0, NOW.minus(40, ChronoUnit.DAYS)));
        store.memories().save(midTerm("popular", "s1", 5, NOW.minus(40, ChronoUnit.DAYS)));
        store.memories().save(midTerm("fresh", "s1", 0, NOW.minus(5, ChronoUnit.DAYS)));
        store.messages().append(user("s1", 1, "still here", 1));
        CompactedSession longTerm = midTerm("long", "s1", 0, NOW.minus(400, ChronoUnit.DAYS));
        longTerm.setMessageStart("s1-m1");
        longTerm.setMessageEnd("s1-m1");
        longTerm.promote(NOW.minus(300, ChronoUnit.DAYS));
        store.memories().save(longTerm);

        CleanupReport report = service.runCleanup(CONFIG);

        assertEquals(1, report.expiredMidTerm());
        assertEquals(0, report.danglingCount());
        assertTrue(store.memories().findById("stale").isEmpty());
        assertTrue(store.memories().findById("popular").isPresent());
        assertTrue(store.memories().findById("fresh").isPresent());
        assertTrue(store.memories().findById("long").isPresent());
    }

    @Test
    void shouldRemoveDanglingLongTermMemories() {
        store.messages().append(user("alive", 1, "hello", 1));
        store.memories().save(longTerm("gone-session", "deleted", null, null));
        store.memories().save(longTerm("gone-range", "alive", "alive-m0", "alive-m1"));
        store.memories().save(longTerm("intact", "alive", "alive-m1", "alive-m1"));

        CleanupReport report = service.runCleanup(CONFIG);

        assertEquals(2, report.danglingCount());
        assertTrue(store.memories().findById("intact").isPresent());
        verify(vectorStore).deleteEmbedding("gone-session");
        verify(vectorStore).deleteEmbedding("gone-range");
    }

    @Test
    void shouldDeleteOrphanedEmbeddings() {
        when(vectorStore.listOrphaned()).thenReturn(List.of("x", "y"));

        CleanupReport report = service.runCleanup(CONFIG);

        assertEquals(2, report.orphanedCount());
        verify(vectorStore).deleteEmbedding("x");
        verify(vectorStore).deleteEmbedding("y");
    }

    @Test
    void shouldKeepRunningOtherPassesWhenOneFails() {
        when(vectorStore.listOrphaned()).thenThrow(new IllegalStateException("index down"));
        store.memories().save(midTerm("stale", "s1", 0, NOW.minus(40, ChronoUnit.DAYS)));

        CleanupReport report = service.runCleanup(CONFIG);

        assertEquals(1, report.expiredMidTerm());
        assertTrue(report.hasErrors());
        assertEquals(List.of("orphaned: index down"), report.errors());
    }

    @Test
    void shouldReportStatsWithoutWriting() {
        store.memories().save(midTerm("stale", "s1", 0, NOW.minus(40, ChronoUnit.DAYS)));
        store.memories().save(longTerm("gone", "deleted", null, null));
        when(vectorStore.listOrphaned()).thenReturn(List.of("x"));

        MemoryStats stats = service.stats(CONFIG);

        assertEquals(1, stats.totalMidTerm());
        assertEquals(1, stats.totalLongTerm());
        assertEquals(1, stats.expiredCandidates());
        assertEquals(1, stats.danglingCandidates());
        assertEquals(1, stats.orphanedCandidates());
        assertEquals(2, store.memories().listAll().size());
        verify(vectorStore, never()).deleteEmbedding(anyString());
        assertFalse(store.memories().findById("stale").isEmpty());
    }

    private CompactedSession midTerm(String id, String sessionId, int accessCount, Instant lastAccessedAt) {
        return CompactedSession.builder()
                .id(id)
                .sessionId(sessionId)
                .summary("summary " + id)
                .accessCount(accessCount)
                .createdAt(lastAccessedAt)
                .lastAccessedAt(lastAccessedAt)
                .build();
    }

    private CompactedSession longTerm(String id, String sessionId, String start, String end) {
        CompactedSession memory = midTerm(id, sessionId, 10, NOW.minus(1, ChronoUnit.DAYS));
        memory.setMessageStart(start);
        memory.setMessageEnd(end);
        memory.promote(NOW);
        return memory;
    }
}
