package me.golemcore.context.port.outbound;

import me.golemcore.context.domain.model.Checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Port for checkpoint persistence. Checkpoints are insert-only.
 */
public interface CheckpointStorePort {

    void save(Checkpoint checkpoint);

    Optional<Checkpoint> findById(String id);

    /**
     * Checkpoints of a session, newest first.
     */
    List<Checkpoint> listBySession(String sessionId);

    Optional<Checkpoint> findLatest(String sessionId);

    boolean delete(String id);

    int deleteBySession(String sessionId);
}
