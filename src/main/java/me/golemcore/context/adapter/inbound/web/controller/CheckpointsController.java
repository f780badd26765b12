package me.golemcore.context.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.context.adapter.inbound.web.dto.CheckpointDto;
import me.golemcore.context.adapter.inbound.web.dto.MessageDto;
import me.golemcore.context.domain.service.CheckpointService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Checkpoint lookup, restore and deletion. Restore returns the snapshot and
 * leaves the live transcript untouched.
 */
@RestController
@RequestMapping("/api/checkpoints")
@RequiredArgsConstructor
public class CheckpointsController {

    private static final String CHECKPOINT_NOT_FOUND = "Checkpoint not found";

    private final CheckpointService checkpointService;

    @GetMapping("/{id}")
    public Mono<ResponseEntity<CheckpointDto>> getCheckpoint(@PathVariable String id) {
        CheckpointDto dto = checkpointService.get(id)
                .map(checkpoint -> ContextDtoMapper.toCheckpointDto(checkpoint, true))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, CHECKPOINT_NOT_FOUND));
        return Mono.just(ResponseEntity.ok(dto));
    }

    @GetMapping("/{id}/restore")
    public Mono<ResponseEntity<List<MessageDto>>> restore(@PathVariable String id) {
        List<MessageDto> messages = checkpointService.restore(id)
                .map(restored -> ContextDtoMapper.toMessageDtos(restored, true))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, CHECKPOINT_NOT_FOUND));
        return Mono.just(ResponseEntity.ok(messages));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteCheckpoint(@PathVariable String id) {
        if (!checkpointService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, CHECKPOINT_NOT_FOUND);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }
}
