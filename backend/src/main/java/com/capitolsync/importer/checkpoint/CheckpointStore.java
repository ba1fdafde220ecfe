package com.capitolsync.importer.checkpoint;

import java.util.Optional;

/**
 * Persistence medium for the single checkpoint.
 */
public interface CheckpointStore {

    /** Stored state, or empty when none exists or none is readable. */
    Optional<CheckpointState> load();

    /**
     * Durably replace the stored state.
     *
     * @throws CheckpointPersistException when the write fails
     */
    void save(CheckpointState state);

    /**
     * Remove the stored state; no-op when none exists.
     *
     * @throws CheckpointPersistException when the delete fails
     */
    void delete();

    /** Where the state lives, for status output. */
    String describe();
}
