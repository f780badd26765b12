package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.CompactionPreparation;
import me.golemcore.context.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.context.testsupport.TestMessages.assistant;
import static me.golemcore.context.testsupport.TestMessages.tool;
import static me.golemcore.context.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompactionPreparationServiceTest {

    private static final String SESSION = "s1";

    private CompactionPreparationService service;

    @BeforeEach
    void setUp() {
        service = new CompactionPreparationService();
    }

    @Test
    void shouldSplitAtKeepLastWhenBoundaryIsClean() {
        List<Message> messages = List.of(
                user(SESSION, 1, "u1", 10),
                assistant(SESSION, 2, "a1", 10),
                user(SESSION, 3, "u2", 10),
                assistant(SESSION, 4, "a2", 10));

        CompactionPreparation preparation = service.prepare(SESSION, messages, 2);

        assertEquals(SESSION, preparation.sessionId());
        assertEquals(4, preparation.totalMessages());
        assertEquals(2, preparation.rawCutIndex());
        assertEquals(2, preparation.adjustedCutIndex());
        assertFalse(preparation.splitTurnDetected());
        assertEquals(List.of("s1-m1", "s1-m2"), ids(preparation.messagesToCompact()));
        assertEquals(List.of("s1-m3", "s1-m4"), ids(preparation.messagesToKeep()));
    }

    @Test
    void shouldKeepToolResultWithItsCall() {
        List<Message> messages = List.of(
                user(SESSION, 1, "u1", 10),
                assistant(SESSION, 2, "calling tool", 10),
                tool(SESSION, 3, "tool output", 10),
                assistant(SESSION, 4, "a2", 10));

        CompactionPreparation preparation = service.prepare(SESSION, messages, 2);

        assertEquals(2, preparation.rawCutIndex());
        assertEquals(1, preparation.adjustedCutIndex());
        assertTrue(preparation.splitTurnDetected());
        assertEquals(List.of("s1-m1"), ids(preparation.messagesToCompact()));
        assertEquals(List.of("s1-m2", "s1-m3", "s1-m4"), ids(preparation.messagesToKeep()));
    }

    @Test
    void shouldWalkBackOverConsecutiveToolResults() {
        List<Message> messages = List.of(
                user(SESSION, 1, "u1", 10),
                assistant(SESSION, 2, "calling two tools", 10),
                tool(SESSION, 3, "first", 10),
                tool(SESSION, 4, "second", 10),
                assistant(SESSION, 5, "done", 10));

        CompactionPreparation preparation = service.prepare(SESSION, messages, 2);

        assertEquals(3, preparation.rawCutIndex());
        assertEquals(1, preparation.adjustedCutIndex());
    }

    @Test
    void shouldNormalizeKeepLastToAtLeastOne() {
        List<Message> messages = List.of(
                user(SESSION, 1, "u1", 10),
                assistant(SESSION, 2, "a1", 10),
                user(SESSION, 3, "u2", 10));

        CompactionPreparation preparation = service.prepare(SESSION, messages, 0);

        assertEquals(1, preparation.keepLastRequested());
        assertEquals(2, preparation.messagesToCompact().size());
        assertEquals(1, preparation.messagesToKeep().size());
    }

    @Test
    void shouldReportNothingToCompactWhenTranscriptFitsInTail() {
        List<Message> messages = List.of(user(SESSION, 1, "u1", 10), assistant(SESSION, 2, "a1", 10));

        CompactionPreparation preparation = service.prepare(SESSION, messages, 3);

        assertFalse(preparation.hasMessagesToCompact());
        assertEquals(2, preparation.messagesToKeep().size());
    }

    @Test
    void shouldHandleNullTranscript() {
        CompactionPreparation preparation = service.prepare(SESSION, null, 3);

        assertEquals(0, preparation.totalMessages());
        assertFalse(preparation.hasMessagesToCompact());
    }

    private List<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getId).toList();
    }
}
