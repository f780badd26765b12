package me.golemcore.context.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.adapter.inbound.web.dto.AppendMessageRequest;
import me.golemcore.context.adapter.inbound.web.dto.CheckpointDto;
import me.golemcore.context.adapter.inbound.web.dto.CompressionResultDto;
import me.golemcore.context.adapter.inbound.web.dto.CreateCheckpointRequest;
import me.golemcore.context.adapter.inbound.web.dto.MessageDto;
import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SessionDeletion;
import me.golemcore.context.domain.service.CheckpointService;
import me.golemcore.context.domain.service.ContextSessionCoordinator;
import me.golemcore.context.domain.service.SessionLifecycleService;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transcript endpoints: append, views, manual compression, cancellation,
 * checkpoints and deletion of a session.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionContextController {

    private static final Set<String> ROLES = Set.of(Message.ROLE_USER, Message.ROLE_ASSISTANT,
            Message.ROLE_SYSTEM, Message.ROLE_TOOL);
    private static final String VIEW_ACTIVE = "active";
    private static final String VIEW_ALL = "all";
    private static final String ACTION_AUTO = "auto";

    private final ContextSessionCoordinator coordinator;
    private final MessageStorePort messageStore;
    private final CheckpointService checkpointService;
    private final SessionLifecycleService lifecycleService;

    @PostMapping("/{sessionId}/messages")
    public Mono<ResponseEntity<CompressionResultDto>> appendMessage(
            @PathVariable String sessionId,
            @RequestBody AppendMessageRequest request) {
        if (request == null || request.getRole() == null || !ROLES.contains(request.getRole())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "role must be one of " + ROLES);
        }
        if (request.getContent() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "content is required");
        }
        Message message = Message.builder()
                .id(request.getId())
                .role(request.getRole())
                .content(request.getContent())
                .toolCallId(request.getToolCallId())
                .toolName(request.getToolName())
                .tokenCount(request.getTokenCount())
                .build();
        return Mono.fromFuture(coordinator.append(sessionId, message))
                .map(outcome -> ResponseEntity.ok(ContextDtoMapper.toCompressionDto(outcome)));
    }

    @GetMapping("/{sessionId}/messages")
    public Mono<ResponseEntity<List<MessageDto>>> getMessages(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = VIEW_ACTIVE) String view) {
        if (VIEW_ACTIVE.equals(view)) {
            return Mono.just(ResponseEntity.ok(ContextDtoMapper.toMessageDtos(messageStore.listActive(sessionId),
                    false)));
        }
        if (VIEW_ALL.equals(view)) {
            return Mono.just(ResponseEntity.ok(ContextDtoMapper.toMessageDtos(
                    messageStore.listByConversation(sessionId), true)));
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "view must be 'active' or 'all'");
    }

    @PostMapping("/{sessionId}/compress")
    public Mono<ResponseEntity<CompressionResultDto>> compress(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = ACTION_AUTO) String action) {
        CompressionAction requested = ACTION_AUTO.equalsIgnoreCase(action)
                ? CompressionAction.NONE
                : CompressionAction.fromValue(action);
        if (requested == CompressionAction.NONE && !ACTION_AUTO.equalsIgnoreCase(action)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "action must be prune, compact, truncate or auto");
        }
        log.info("[API] Compression requested for session {}: {}", sessionId, action);
        return Mono.fromFuture(coordinator.compress(sessionId, requested))
                .map(result -> ResponseEntity.ok(ContextDtoMapper.toCompressionDto(result)));
    }

    @PostMapping("/{sessionId}/cancel")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String sessionId) {
        boolean cancelled = coordinator.cancel(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of("sessionId", sessionId, "cancelled", cancelled)));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionDeletion>> deleteSession(@PathVariable String sessionId) {
        return Mono.fromFuture(lifecycleService.deleteSession(sessionId))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{sessionId}/checkpoints")
    public Mono<ResponseEntity<List<CheckpointDto>>> listCheckpoints(@PathVariable String sessionId) {
        List<CheckpointDto> dtos = checkpointService.list(sessionId).stream()
                .map(checkpoint -> ContextDtoMapper.toCheckpointDto(checkpoint, false))
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping("/{sessionId}/checkpoints")
    public Mono<ResponseEntity<CheckpointDto>> createCheckpoint(
            @PathVariable String sessionId,
            @RequestBody(required = false) CreateCheckpointRequest request) {
        String name = request != null ? request.getName() : null;
        return Mono.fromFuture(coordinator.checkpoint(sessionId, name))
                .map(checkpoint -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ContextDtoMapper.toCheckpointDto(checkpoint, false)));
    }
}
