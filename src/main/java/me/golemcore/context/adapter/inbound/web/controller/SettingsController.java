package me.golemcore.context.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.adapter.inbound.web.dto.SettingsUpdateRequest;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.EngineSettings;
import me.golemcore.context.domain.model.MemoryAutoUpgradeConfig;
import me.golemcore.context.domain.model.MemoryCleanupConfig;
import me.golemcore.context.domain.service.EngineSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Engine settings endpoints. Updates are partial: absent fields keep their
 * current value, and the merged result is validated before it is saved.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
@Slf4j
public class SettingsController {

    private final EngineSettingsService settingsService;

    @GetMapping
    public Mono<ResponseEntity<EngineSettings>> getSettings() {
        return Mono.just(ResponseEntity.ok(settingsService.getSettings()));
    }

    @PutMapping
    public Mono<ResponseEntity<EngineSettings>> updateSettings(@RequestBody SettingsUpdateRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        EngineSettings current = settingsService.getSettings();
        ContextEngineConfig context = request.getContext() != null
                ? mergeContext(current.getContext(), request.getContext())
                : null;
        MemoryAutoUpgradeConfig autoUpgrade = request.getAutoUpgrade() != null
                ? mergeAutoUpgrade(current.getAutoUpgrade(), request.getAutoUpgrade())
                : null;
        MemoryCleanupConfig cleanup = request.getCleanup() != null
                ? mergeCleanup(current.getCleanup(), request.getCleanup())
                : null;
        EngineSettings updated = settingsService.update(context, autoUpgrade, cleanup);
        log.info("[API] Engine settings updated");
        return Mono.just(ResponseEntity.ok(updated));
    }

    private ContextEngineConfig mergeContext(ContextEngineConfig current, SettingsUpdateRequest.ContextSection patch) {
        return current.toBuilder()
                .enabled(patch.getEnabled() != null ? patch.getEnabled() : current.enabled())
                .maxTokens(patch.getMaxTokens() != null ? patch.getMaxTokens() : current.maxTokens())
                .modelContextLimit(patch.getModelContextLimit() != null ? patch.getModelContextLimit()
                        : current.modelContextLimit())
                .modelOutputLimit(patch.getModelOutputLimit() != null ? patch.getModelOutputLimit()
                        : current.modelOutputLimit())
                .pruneThreshold(patch.getPruneThreshold() != null ? patch.getPruneThreshold()
                        : current.pruneThreshold())
                .compactThreshold(patch.getCompactThreshold() != null ? patch.getCompactThreshold()
                        : current.compactThreshold())
                .truncateThreshold(patch.getTruncateThreshold() != null ? patch.getTruncateThreshold()
                        : current.truncateThreshold())
                .messagesToKeep(patch.getMessagesToKeep() != null ? patch.getMessagesToKeep()
                        : current.messagesToKeep())
                .checkpointInterval(patch.getCheckpointInterval() != null ? patch.getCheckpointInterval()
                        : current.checkpointInterval())
                .pruneMinChars(patch.getPruneMinChars() != null ? patch.getPruneMinChars()
                        : current.pruneMinChars())
                .checkpointBeforeCompression(patch.getCheckpointBeforeCompression() != null
                        ? patch.getCheckpointBeforeCompression()
                        : current.checkpointBeforeCompression())
                .build();
    }

    private MemoryAutoUpgradeConfig mergeAutoUpgrade(MemoryAutoUpgradeConfig current,
            SettingsUpdateRequest.AutoUpgradeSection patch) {
        return current.toBuilder()
                .enabled(patch.getEnabled() != null ? patch.getEnabled() : current.enabled())
                .daysThreshold(patch.getDaysThreshold() != null ? patch.getDaysThreshold()
                        : current.daysThreshold())
                .minAccessCount(patch.getMinAccessCount() != null ? patch.getMinAccessCount()
                        : current.minAccessCount())
                .batchSize(patch.getBatchSize() != null ? patch.getBatchSize() : current.batchSize())
                .build();
    }

    private MemoryCleanupConfig mergeCleanup(MemoryCleanupConfig current, SettingsUpdateRequest.CleanupSection patch) {
        return current.toBuilder()
                .retentionDays(patch.getRetentionDays() != null ? patch.getRetentionDays()
                        : current.retentionDays())
                .minAccessCount(patch.getMinAccessCount() != null ? patch.getMinAccessCount()
                        : current.minAccessCount())
                .build();
    }
}
