package me.golemcore.context.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void shouldExposeCondenseParentOnlyWhenCondensed() {
        Message message = Message.builder().id("m1").role(Message.ROLE_USER).content("hi").build();
        assertTrue(message.isActive());
        assertNull(message.getCondenseParent());

        message.markCondensed("c1");

        assertFalse(message.isActive());
        assertEquals("c1", message.getCondenseParent());
        assertNull(message.getTruncationId());
    }

    @Test
    void shouldRefuseSecondStateChange() {
        Message message = Message.builder().id("m1").role(Message.ROLE_USER).content("hi").build();
        message.markTruncated("t1");

        assertTrue(message.isTruncationMarker());
        assertEquals("t1", message.getTruncationId());
        assertThrows(IllegalStateException.class, () -> message.markCondensed("c1"));
        assertThrows(IllegalStateException.class, () -> message.markTruncated("t2"));
    }

    @Test
    void shouldBuildSummaryWithCondenseId() {
        Message summary = Message.summaryOf("s1", "conv", "c1", "[Conversation summary]\nx", NOW);

        assertTrue(summary.isSummary());
        assertTrue(summary.isActive());
        assertEquals("c1", summary.getCondenseId());
        assertEquals(Message.ROLE_SYSTEM, summary.getRole());
        assertThrows(NullPointerException.class, () -> Message.summaryOf("s2", "conv", null, "x", NOW));
    }

    @Test
    void shouldFilterActiveMessages() {
        Message active = Message.builder().id("a").build();
        Message condensed = Message.builder().id("b").build();
        condensed.markCondensed("c1");

        List<Message> filtered = Message.activeOnly(List.of(active, condensed));

        assertEquals(List.of(active), filtered);
        assertTrue(Message.activeOnly(null).isEmpty());
    }

    @Test
    void shouldPromoteMemoryOnlyOnce() {
        CompactedSession memory = CompactedSession.builder().id("mem-1").build();

        TierTransition transition = memory.promote(NOW);

        assertEquals(MemoryTier.MID_TERM, transition.from());
        assertEquals(MemoryTier.LONG_TERM, transition.to());
        assertTrue(memory.isLongTerm());
        assertEquals(NOW, memory.getTierUpdatedAt());
        assertEquals(List.of(transition), memory.getPromotionHistory());
        assertThrows(IllegalStateException.class, () -> memory.promote(NOW.plusSeconds(1)));
    }

    @Test
    void shouldCopySnapshotMessagesInCheckpoint() {
        Message original = Message.builder().id("m1").content("hello").build();
        Checkpoint checkpoint = Checkpoint.builder().id("cp").messagesSnapshot(List.of(original)).build();

        original.setContent("changed");
        List<Message> restored = checkpoint.copyMessages();
        restored.get(0).setContent("mutated");

        assertEquals("hello", checkpoint.messagesSnapshot().get(0).getContent());
    }

    @Test
    void shouldNotExposeSnapshotMessagesThroughAccessor() {
        Message original = Message.builder().id("m1").content("hello").build();
        Checkpoint checkpoint = Checkpoint.builder().id("cp").messagesSnapshot(List.of(original)).build();

        checkpoint.messagesSnapshot().get(0).setContent("mutated");
        checkpoint.messagesSnapshot().get(0).markTruncated("t1");

        Message stored = checkpoint.messagesSnapshot().get(0);
        assertEquals("hello", stored.getContent());
        assertTrue(stored.isActive());
    }

    @Test
    void shouldRenderPrunedMarkerWithoutChangingContent() {
        Message message = Message.builder().id("m1").role(Message.ROLE_TOOL).content("x".repeat(42)).build();
        assertEquals("x".repeat(42), message.getEffectiveContent());

        message.setPruned(true);

        assertEquals("[Tool output pruned: 42 chars]", message.getEffectiveContent());
        assertEquals("x".repeat(42), message.getContent());
    }
}
