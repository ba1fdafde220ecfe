package com.capitolsync.importer.checkpoint;

import java.util.Optional;

/**
 * Keeps the checkpoint in memory only. Used for dry runs so the persisted cursor is never moved.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private CheckpointState state;

    public InMemoryCheckpointStore() {
    }

    public InMemoryCheckpointStore(CheckpointState initial) {
        this.state = initial != null ? initial.copy() : null;
    }

    @Override
    public synchronized Optional<CheckpointState> load() {
        return Optional.ofNullable(state).map(CheckpointState::copy);
    }

    @Override
    public synchronized void save(CheckpointState state) {
        this.state = state.copy();
    }

    @Override
    public synchronized void delete() {
        state = null;
    }

    @Override
    public String describe() {
        return "memory";
    }
}
