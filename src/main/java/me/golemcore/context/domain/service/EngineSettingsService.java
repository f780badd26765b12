package me.golemcore.context.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.ContextEngineException;
import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.EngineSettings;
import me.golemcore.context.domain.model.MemoryAutoUpgradeConfig;
import me.golemcore.context.domain.model.MemoryCleanupConfig;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the user-editable engine settings. Loaded lazily from
 * {@code preferences/engine-settings.json}, falling back to the
 * {@code engine.context.*} and {@code engine.memory.*} property defaults, and
 * persisted on every change.
 *
 * <p>
 * The configuration records validate themselves on construction, so an invalid
 * update fails with a
 * {@link me.golemcore.context.domain.exception.ConfigurationException} before
 * anything is stored.
 */
@Service
@Slf4j
public class EngineSettingsService {

    private static final String PREFERENCES_DIR = "preferences";
    private static final String SETTINGS_FILE = "engine-settings.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    private final AtomicReference<EngineSettings> settingsRef = new AtomicReference<>();

    public EngineSettingsService(StoragePort storagePort, ObjectMapper objectMapper, EngineProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Current settings (lazy-loaded, cached). The returned object is a copy.
     */
    public EngineSettings getSettings() {
        return current().toBuilder().build();
    }

    public ContextEngineConfig getContextConfig() {
        return current().getContext();
    }

    public MemoryAutoUpgradeConfig getAutoUpgradeConfig() {
        return current().getAutoUpgrade();
    }

    public MemoryCleanupConfig getCleanupConfig() {
        return current().getCleanup();
    }

    /**
     * Replace the given sections and persist. {@code null} sections keep their
     * current value.
     */
    public synchronized EngineSettings update(ContextEngineConfig context, MemoryAutoUpgradeConfig autoUpgrade,
            MemoryCleanupConfig cleanup) {
        EngineSettings existing = current();
        EngineSettings updated = EngineSettings.builder()
                .context(context != null ? context : existing.getContext())
                .autoUpgrade(autoUpgrade != null ? autoUpgrade : existing.getAutoUpgrade())
                .cleanup(cleanup != null ? cleanup : existing.getCleanup())
                .build();
        persist(updated);
        settingsRef.set(updated);
        log.info("[Settings] Engine settings updated");
        return updated.toBuilder().build();
    }

    public EngineSettings defaults() {
        EngineProperties.ContextDefaults ctx = properties.getContext();
        EngineProperties.MemoryDefaults memory = properties.getMemory();
        return EngineSettings.builder()
                .context(new ContextEngineConfig(ctx.isEnabled(), ctx.getMaxTokens(), ctx.getModelContextLimit(),
                        ctx.getModelOutputLimit(), ctx.getPruneThreshold(), ctx.getCompactThreshold(),
                        ctx.getTruncateThreshold(), ctx.getMessagesToKeep(), ctx.getCheckpointInterval(),
                        ctx.getPruneMinChars(), ctx.isCheckpointBeforeCompression()))
                .autoUpgrade(new MemoryAutoUpgradeConfig(memory.isAutoUpgradeEnabled(), memory.getDaysThreshold(),
                        memory.getMinAccessCount(), memory.getPromotionBatchSize()))
                .cleanup(new MemoryCleanupConfig(memory.getRetentionDays(), memory.getExpiryMinAccessCount()))
                .build();
    }

    private EngineSettings current() {
        EngineSettings current = settingsRef.get();
        if (current == null) {
            synchronized (this) {
                current = settingsRef.get();
                if (current == null) {
                    current = loadOrDefault();
                    settingsRef.set(current);
                }
            }
        }
        return current;
    }

    private EngineSettings loadOrDefault() {
        EngineSettings defaults = defaults();
        String json;
        try {
            json = storagePort.getText(PREFERENCES_DIR, SETTINGS_FILE).join();
        } catch (CompletionException e) {
            log.warn("[Settings] Failed to read saved settings, using defaults: {}", e.getMessage());
            return defaults;
        }
        if (json == null || json.isBlank()) {
            log.info("[Settings] No saved engine settings, using defaults");
            return defaults;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[Settings] Saved engine settings are not valid JSON, using defaults: {}", e.getMessage());
            return defaults;
        }
        EngineSettings loaded = EngineSettings.builder()
                .context(readSection(root, "context", ContextEngineConfig.class, defaults.getContext()))
                .autoUpgrade(readSection(root, "autoUpgrade", MemoryAutoUpgradeConfig.class,
                        defaults.getAutoUpgrade()))
                .cleanup(readSection(root, "cleanup", MemoryCleanupConfig.class, defaults.getCleanup()))
                .build();
        log.info("[Settings] Loaded engine settings from storage");
        return loaded;
    }

    private <T> T readSection(JsonNode root, String field, Class<T> type, T fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException | ContextEngineException e) {
            log.warn("[Settings] Ignoring invalid '{}' section, using defaults: {}", field, e.getMessage());
            return fallback;
        }
    }

    private void persist(EngineSettings settings) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
            storagePort.putTextAtomic(PREFERENCES_DIR, SETTINGS_FILE, json, true).join();
            log.debug("[Settings] Persisted engine settings");
        } catch (JsonProcessingException | CompletionException e) {
            throw new StorageException("Failed to persist engine settings", e);
        }
    }
}
