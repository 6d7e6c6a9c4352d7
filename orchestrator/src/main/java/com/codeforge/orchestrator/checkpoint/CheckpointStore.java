package com.codeforge.orchestrator.checkpoint;

import java.util.Optional;

/**
 * Durable per-project checkpoint storage.
 *
 * Implementations must be safe for concurrent use: saves for different
 * project ids never interfere, and a save replaces the previous checkpoint
 * for its id atomically (readers see the old or the new one, never a mix).
 */
public interface CheckpointStore {

    /**
     * Replace the checkpoint for {@code checkpoint.projectId()}.
     *
     * @return a human-readable location of the written checkpoint
     */
    String save(Checkpoint checkpoint);

    /** The most recent checkpoint, or empty if none was ever saved. */
    Optional<Checkpoint> load(String projectId);

    /** Where the checkpoint for this id lives (whether or not it exists yet). */
    String locationOf(String projectId);

    /** @return true if a checkpoint existed and was removed */
    boolean delete(String projectId);
}
