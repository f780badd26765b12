package me.golemcore.context.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.context.domain.exception.ConfigurationException;
import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.EngineSettings;
import me.golemcore.context.domain.model.MemoryAutoUpgradeConfig;
import me.golemcore.context.domain.model.MemoryCleanupConfig;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EngineSettingsServiceTest {

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private EngineProperties properties;
    private Map<String, String> persisted;
    private EngineSettingsService service;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        persisted = new ConcurrentHashMap<>();

        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenAnswer(invocation -> {
                    persisted.put(invocation.getArgument(1), invocation.getArgument(2));
                    return CompletableFuture.completedFuture(null);
                });
        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(persisted.get(invocation.getArgument(1))));

        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        properties = new EngineProperties();
        properties.getContext().setMaxTokens(64_000);
        service = new EngineSettingsService(storagePort, objectMapper, properties);
    }

    @Test
    void shouldUsePropertyDefaultsWhenNothingSaved() {
        ContextEngineConfig config = service.getContextConfig();

        assertEquals(64_000, config.maxTokens());
        assertEquals(0.70, config.pruneThreshold());
        assertEquals(MemoryAutoUpgradeConfig.defaults(), service.getAutoUpgradeConfig());
        assertEquals(MemoryCleanupConfig.defaults(), service.getCleanupConfig());
        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldPersistUpdateAndReloadIt() {
        ContextEngineConfig context = service.getContextConfig().toBuilder().messagesToKeep(7).build();
        MemoryCleanupConfig cleanup = new MemoryCleanupConfig(10, 1);

        service.update(context, null, cleanup);

        assertTrue(persisted.containsKey("engine-settings.json"));
        EngineSettingsService reloaded = new EngineSettingsService(storagePort, objectMapper, properties);
        assertEquals(7, reloaded.getContextConfig().messagesToKeep());
        assertEquals(cleanup, reloaded.getCleanupConfig());
        assertEquals(MemoryAutoUpgradeConfig.defaults(), reloaded.getAutoUpgradeConfig());
    }

    @Test
    void shouldRejectInvalidConfigurationBeforeStoring() {
        assertThrows(ConfigurationException.class,
                () -> service.update(service.getContextConfig().toBuilder().pruneThreshold(0.99).build(), null,
                        null));

        assertTrue(persisted.isEmpty());
    }

    @Test
    void shouldFallBackPerSectionWhenSavedSectionIsInvalid() {
        persisted.put("engine-settings.json", """
                {
                  "context": {"enabled": true, "maxTokens": -5},
                  "cleanup": {"retentionDays": 12, "minAccessCount": 2}
                }
                """);

        assertEquals(64_000, service.getContextConfig().maxTokens());
        assertEquals(new MemoryCleanupConfig(12, 2), service.getCleanupConfig());
    }

    @Test
    void shouldUseDefaultsWhenSavedFileIsNotJson() {
        persisted.put("engine-settings.json", "not json");

        assertEquals(64_000, service.getContextConfig().maxTokens());
    }

    @Test
    void shouldUseDefaultsWhenStorageReadFails() {
        when(storagePort.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new StorageException("disk gone")));

        assertEquals(64_000, service.getContextConfig().maxTokens());
    }

    @Test
    void shouldKeepPreviousSettingsWhenPersistFails() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new StorageException("disk full")));
        ContextEngineConfig changed = service.getContextConfig().toBuilder().messagesToKeep(9).build();

        assertThrows(StorageException.class, () -> service.update(changed, null, null));

        assertEquals(ContextEngineConfig.DEFAULT_MESSAGES_TO_KEEP, service.getContextConfig().messagesToKeep());
    }

    @Test
    void shouldReturnDetachedCopy() {
        EngineSettings settings = service.getSettings();
        settings.setCleanup(new MemoryCleanupConfig(1, 0));

        assertEquals(MemoryCleanupConfig.defaults(), service.getCleanupConfig());
    }
}
