package me.golemcore.context.adapter.inbound.web.controller;

import me.golemcore.context.adapter.inbound.web.dto.AppendMessageRequest;
import me.golemcore.context.adapter.inbound.web.dto.CheckpointDto;
import me.golemcore.context.adapter.inbound.web.dto.CompressionResultDto;
import me.golemcore.context.adapter.inbound.web.dto.CreateCheckpointRequest;
import me.golemcore.context.adapter.inbound.web.dto.MessageDto;
import me.golemcore.context.domain.model.AppendOutcome;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.CompressionResult;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SessionDeletion;
import me.golemcore.context.domain.model.TokenUsage;
import me.golemcore.context.domain.service.CheckpointService;
import me.golemcore.context.domain.service.ContextSessionCoordinator;
import me.golemcore.context.domain.service.SessionLifecycleService;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.context.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionContextControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");
    private static final TokenUsage USAGE = new TokenUsage(100, 1000, 0.1, 1);

    private ContextSessionCoordinator coordinator;
    private MessageStorePort messageStore;
    private CheckpointService checkpointService;
    private SessionLifecycleService lifecycleService;
    private SessionContextController controller;

    @BeforeEach
    void setUp() {
        coordinator = mock(ContextSessionCoordinator.class);
        messageStore = mock(MessageStorePort.class);
        checkpointService = mock(CheckpointService.class);
        lifecycleService = mock(SessionLifecycleService.class);
        controller = new SessionContextController(coordinator, messageStore, checkpointService, lifecycleService);
    }

    @Test
    void shouldAppendMessageAndReportCompression() {
        Message stored = user("s1", 1, "hello", 2);
        Checkpoint autoCheckpoint = checkpoint("cp-1");
        when(coordinator.append(eq("s1"), any(Message.class))).thenReturn(CompletableFuture.completedFuture(
                new AppendOutcome(stored, CompressionResult.none("s1", USAGE), autoCheckpoint)));
        AppendMessageRequest request = AppendMessageRequest.builder()
                .role("user")
                .content("hello")
                .tokenCount(2)
                .build();

        StepVerifier.create(controller.appendMessage("s1", request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    CompressionResultDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("s1-m1", body.getMessageId());
                    assertEquals("none", body.getAppliedAction());
                    assertEquals("cp-1", body.getAutoCheckpointId());
                    assertEquals(100, body.getTokensBefore());
                })
                .verifyComplete();

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(coordinator).append(eq("s1"), captor.capture());
        assertEquals("hello", captor.getValue().getContent());
        assertEquals(2, captor.getValue().getTokenCount());
        assertNull(captor.getValue().getTimestamp());
    }

    @Test
    void shouldRejectUnknownRole() {
        AppendMessageRequest request = AppendMessageRequest.builder().role("robot").content("x").build();

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.appendMessage("s1", request));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        verify(coordinator, never()).append(any(), any());
    }

    @Test
    void shouldRejectMissingContent() {
        AppendMessageRequest request = AppendMessageRequest.builder().role("user").build();

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.appendMessage("s1", request));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
    }

    @Test
    void shouldPropagateCancelledAppend() {
        when(coordinator.append(eq("s1"), any(Message.class)))
                .thenReturn(CompletableFuture.failedFuture(new CancellationException("append interrupted")));
        AppendMessageRequest request = AppendMessageRequest.builder().role("user").content("x").build();

        StepVerifier.create(controller.appendMessage("s1", request))
                .expectError(CancellationException.class)
                .verify();
    }

    @Test
    void shouldReturnActiveOrFullView() {
        Message condensed = user("s1", 1, "old", 1);
        condensed.markCondensed("c1");
        Message active = user("s1", 2, "new", 1);
        when(messageStore.listActive("s1")).thenReturn(List.of(active));
        when(messageStore.listByConversation("s1")).thenReturn(List.of(condensed, active));

        StepVerifier.create(controller.getMessages("s1", "active"))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
        StepVerifier.create(controller.getMessages("s1", "all"))
                .assertNext(response -> {
                    List<MessageDto> body = response.getBody();
                    assertEquals(2, body.size());
                    assertEquals("CONDENSED", body.get(0).getCompressionState());
                    assertEquals("c1", body.get(0).getReplacedBy());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownView() {
        assertThrows(ResponseStatusException.class, () -> controller.getMessages("s1", "deleted"));
    }

    @Test
    void shouldMapAutoToEvaluatorChoice() {
        when(coordinator.compress("s1", CompressionAction.NONE))
                .thenReturn(CompletableFuture.completedFuture(CompressionResult.none("s1", USAGE)));

        StepVerifier.create(controller.compress("s1", "auto"))
                .assertNext(response -> assertEquals("none", response.getBody().getAppliedAction()))
                .verifyComplete();
    }

    @Test
    void shouldRunRequestedAction() {
        CompressionResult result = CompressionResult.builder()
                .sessionId("s1")
                .requestedAction(CompressionAction.COMPACT)
                .appliedAction(CompressionAction.PRUNE)
                .degraded(true)
                .usageBefore(USAGE)
                .usageAfter(USAGE)
                .detail("summarizer timed out after 30000ms")
                .build();
        when(coordinator.compress("s1", CompressionAction.COMPACT))
                .thenReturn(CompletableFuture.completedFuture(result));

        StepVerifier.create(controller.compress("s1", "COMPACT"))
                .assertNext(response -> {
                    CompressionResultDto body = response.getBody();
                    assertEquals("compact", body.getRequestedAction());
                    assertEquals("prune", body.getAppliedAction());
                    assertEquals(true, body.isDegraded());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectExplicitNoneAndUnknownActions() {
        assertThrows(ResponseStatusException.class, () -> controller.compress("s1", "none"));
        assertThrows(IllegalArgumentException.class, () -> controller.compress("s1", "shrink"));
    }

    @Test
    void shouldCancelRunningTask() {
        when(coordinator.cancel("s1")).thenReturn(true);

        StepVerifier.create(controller.cancel("s1"))
                .assertNext(response -> assertEquals(Map.of("sessionId", "s1", "cancelled", true),
                        response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldDeleteSession() {
        SessionDeletion deletion = new SessionDeletion("s1", 3, 1, 2);
        when(lifecycleService.deleteSession("s1")).thenReturn(CompletableFuture.completedFuture(deletion));

        StepVerifier.create(controller.deleteSession("s1"))
                .assertNext(response -> assertEquals(deletion, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldListCheckpointsWithoutMessages() {
        when(checkpointService.list("s1")).thenReturn(List.of(checkpoint("cp-1")));

        StepVerifier.create(controller.listCheckpoints("s1"))
                .assertNext(response -> {
                    List<CheckpointDto> body = response.getBody();
                    assertEquals(1, body.size());
                    assertEquals("cp-1", body.get(0).getId());
                    assertNull(body.get(0).getMessages());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateNamedCheckpoint() {
        when(coordinator.checkpoint("s1", "before deploy"))
                .thenReturn(CompletableFuture.completedFuture(checkpoint("cp-2")));

        StepVerifier.create(controller.createCheckpoint("s1", new CreateCheckpointRequest("before deploy")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("cp-2", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateCheckpointWithoutBody() {
        when(coordinator.checkpoint("s1", null)).thenReturn(CompletableFuture.completedFuture(checkpoint("cp-3")));

        StepVerifier.create(controller.createCheckpoint("s1", null))
                .assertNext(response -> assertEquals("cp-3", response.getBody().getId()))
                .verifyComplete();
    }

    private Checkpoint checkpoint(String id) {
        return Checkpoint.builder()
                .id(id)
                .sessionId("s1")
                .name("name")
                .messageCount(1)
                .tokenCount(2)
                .summary("Snapshot - 1 messages")
                .messagesSnapshot(List.of(user("s1", 1, "hello", 2)))
                .createdAt(NOW)
                .build();
    }
}
