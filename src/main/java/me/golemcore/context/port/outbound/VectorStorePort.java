package me.golemcore.context.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the semantic index that backs long-term memories. Entries are keyed
 * by memory record id.
 */
public interface VectorStorePort {

    CompletableFuture<Void> upsertEmbedding(String memoryId, String text);

    /**
     * Ids of embeddings with no corresponding memory record.
     */
    List<String> listOrphaned();

    void deleteEmbedding(String id);
}
