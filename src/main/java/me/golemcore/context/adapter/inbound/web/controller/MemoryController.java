package me.golemcore.context.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.adapter.inbound.web.dto.MemoryDto;
import me.golemcore.context.auto.MemoryMaintenanceScheduler;
import me.golemcore.context.domain.model.CleanupReport;
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryStats;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.domain.model.PromotionReport;
import me.golemcore.context.domain.service.EngineSettingsService;
import me.golemcore.context.domain.service.MemoryCleanupService;
import me.golemcore.context.domain.service.MidTermMemoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Memory browser and maintenance endpoints.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final MidTermMemoryService memoryService;
    private final MemoryCleanupService cleanupService;
    private final MemoryMaintenanceScheduler maintenanceScheduler;
    private final EngineSettingsService settingsService;

    @GetMapping
    public Mono<ResponseEntity<List<MemoryDto>>> listMemories(
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) String tier) {
        MemoryTier tierFilter = tier != null ? MemoryTier.fromValue(tier) : null;
        List<CompactedSession> memories;
        if (sessionId != null) {
            memories = memoryService.listBySession(sessionId).stream()
                    .filter(memory -> tierFilter == null || memory.getTier() == tierFilter)
                    .toList();
        } else if (tierFilter != null) {
            memories = memoryService.listByTier(tierFilter);
        } else {
            memories = memoryService.listAll();
        }
        List<MemoryDto> dtos = memories.stream().map(ContextDtoMapper::toMemoryDto).toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping("/access/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> recordAccess(@PathVariable String sessionId) {
        int updated = memoryService.recordAccess(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of("sessionId", sessionId, "updated", updated)));
    }

    @PostMapping("/promotion/run")
    public Mono<ResponseEntity<PromotionReport>> runPromotion() {
        log.info("[API] Manual promotion run requested");
        return Mono.fromCallable(maintenanceScheduler::runPromotion)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/cleanup/run")
    public Mono<ResponseEntity<CleanupReport>> runCleanup() {
        log.info("[API] Manual cleanup run requested");
        return Mono.fromCallable(maintenanceScheduler::runCleanup)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<MemoryStats>> getStats() {
        return Mono.just(ResponseEntity.ok(cleanupService.stats(settingsService.getCleanupConfig())));
    }
}
