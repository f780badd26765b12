package me.golemcore.context.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.CompactedSessionStorePort;
import me.golemcore.context.port.outbound.VectorStorePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Semantic index for long-term memories, using an OpenAI embedding model and
 * langchain4j's in-memory embedding store.
 *
 * <p>
 * Entries are keyed by memory record id. An entry whose record no longer exists
 * in {@link CompactedSessionStorePort} is reported as orphaned.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code engine.embedding.api-key} - OpenAI API key
 * <li>{@code engine.embedding.model} - embedding model name
 * </ul>
 */
@Component
@Slf4j
public class Langchain4jVectorStoreAdapter implements VectorStorePort {

    private final EngineProperties properties;
    private final CompactedSessionStorePort memoryStore;
    private final InMemoryEmbeddingStore<TextSegment> embeddingStore = new InMemoryEmbeddingStore<>();
    private final Set<String> indexedIds = ConcurrentHashMap.newKeySet();

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    @Autowired
    public Langchain4jVectorStoreAdapter(EngineProperties properties, CompactedSessionStorePort memoryStore) {
        this.properties = properties;
        this.memoryStore = memoryStore;
    }

    /**
     * Constructor for tests that supply the model directly.
     */
    Langchain4jVectorStoreAdapter(EngineProperties properties, CompactedSessionStorePort memoryStore,
            EmbeddingModel embeddingModel) {
        this(properties, memoryStore);
        this.embeddingModel = embeddingModel;
        this.initialized = true;
    }

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        EngineProperties.EmbeddingProperties config = properties.getEmbedding();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key not configured, long-term memories will not be indexed");
            initialized = true;
            return;
        }

        try {
            embeddingModel = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.getModel())
                    .build();
            log.info("[Embedding] Embedding model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<Void> upsertEmbedding(String memoryId, String text) {
        return CompletableFuture.runAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            synchronized (embeddingStore) {
                if (indexedIds.contains(memoryId)) {
                    embeddingStore.remove(memoryId);
                }
                embeddingStore.add(memoryId, response.content());
                indexedIds.add(memoryId);
            }
            log.debug("[Embedding] Indexed memory {}", memoryId);
        });
    }

    @Override
    public List<String> listOrphaned() {
        List<String> orphaned = new ArrayList<>();
        for (String id : List.copyOf(indexedIds)) {
            if (memoryStore.findById(id).isEmpty()) {
                orphaned.add(id);
            }
        }
        return orphaned;
    }

    @Override
    public void deleteEmbedding(String id) {
        synchronized (embeddingStore) {
            if (indexedIds.remove(id)) {
                embeddingStore.remove(id);
                log.debug("[Embedding] Removed embedding {}", id);
            }
        }
    }

    int size() {
        return indexedIds.size();
    }
}
