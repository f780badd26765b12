package me.golemcore.context.adapter.outbound.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static me.golemcore.context.testsupport.TestMessages.assistant;
import static me.golemcore.context.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteCheckpointStore store;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        SqliteDatabase database = new SqliteDatabase(properties);
        database.init();
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        store = new SqliteCheckpointStore(database, objectMapper);
    }

    @Test
    void shouldRoundTripSnapshotIncludingCompressionState() {
        Message condensed = user("s1", 1, "old", 5);
        condensed.markCondensed("c1");
        Checkpoint checkpoint = checkpoint("cp-1", "s1", NOW, List.of(condensed, assistant("s1", 2, "new", 7)));

        store.save(checkpoint);

        Checkpoint read = store.findById("cp-1").orElseThrow();
        assertEquals(checkpoint, read);
        assertEquals("c1", read.messagesSnapshot().get(0).getCondenseParent());
    }

    @Test
    void shouldListNewestFirst() {
        store.save(checkpoint("cp-old", "s1", NOW.minusSeconds(60), List.of()));
        store.save(checkpoint("cp-new", "s1", NOW, List.of()));
        store.save(checkpoint("cp-other", "s2", NOW, List.of()));

        assertEquals(List.of("cp-new", "cp-old"), store.listBySession("s1").stream().map(Checkpoint::id).toList());
        assertEquals("cp-new", store.findLatest("s1").orElseThrow().id());
        assertTrue(store.findLatest("none").isEmpty());
    }

    @Test
    void shouldDeleteSingleAndBySession() {
        store.save(checkpoint("a", "s1", NOW, List.of()));
        store.save(checkpoint("b", "s1", NOW.plusSeconds(1), List.of()));
        store.save(checkpoint("c", "s2", NOW, List.of()));

        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(1, store.deleteBySession("s1"));
        assertTrue(store.findById("c").isPresent());
    }

    private Checkpoint checkpoint(String id, String sessionId, Instant createdAt, List<Message> messages) {
        return Checkpoint.builder()
                .id(id)
                .sessionId(sessionId)
                .name("name " + id)
                .messageCount(messages.size())
                .tokenCount(12)
                .summary("Snapshot - " + messages.size() + " messages")
                .messagesSnapshot(messages)
                .createdAt(createdAt)
                .build();
    }
}
