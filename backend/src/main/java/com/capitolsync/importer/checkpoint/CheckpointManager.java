package com.capitolsync.importer.checkpoint;

import com.capitolsync.importer.phase.ImportPhase;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the checkpoint of the active run. Every mutation is persisted before the method returns;
 * a failed write surfaces as {@link CheckpointPersistException}.
 * <p>
 * Methods are synchronized so a shutdown-hook {@link #flush()} cannot interleave with a batch update.
 */
@Slf4j
public class CheckpointManager {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CheckpointStore store;
    private final Clock clock;
    private CheckpointState state;

    public CheckpointManager(CheckpointStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public CheckpointManager(CheckpointStore store) {
        this(store, Clock.systemUTC());
    }

    /** Existing state, if any. Does not write. */
    public synchronized Optional<CheckpointState> load() {
        Optional<CheckpointState> loaded = store.load();
        state = loaded.orElse(null);
        return loaded.map(CheckpointState::copy);
    }

    /** New state at the first phase with zero counters; replaces any existing state. */
    public synchronized CheckpointState create() {
        Instant now = Instant.now(clock);
        CheckpointState fresh = new CheckpointState();
        fresh.setRunId(newRunId(now));
        fresh.setPhase(ImportPhase.first());
        fresh.setCreatedAt(now);
        fresh.setUpdatedAt(now);
        store.save(fresh);
        state = fresh;
        log.info("Created checkpoint {} at {}", fresh.getRunId(), store.describe());
        return fresh.copy();
    }

    public synchronized CheckpointState loadOrCreate() {
        Optional<CheckpointState> existing = load();
        return existing.isPresent() ? existing.get() : create();
    }

    /**
     * Merge the set fields of {@code update} and persist.
     *
     * @throws IllegalStateException when no checkpoint is loaded
     */
    public synchronized CheckpointState update(CheckpointUpdate update) {
        CheckpointState current = requireState();
        CheckpointState next = current.copy();
        update.applyTo(next);
        next.setUpdatedAt(Instant.now(clock));
        store.save(next);
        state = next;
        return next.copy();
    }

    /** Appends the current phase to completedPhases; no-op when already present. */
    public synchronized void completeCurrentPhase() {
        CheckpointState current = requireState();
        if (current.isCompleted(current.getPhase())) {
            return;
        }
        CheckpointState next = current.copy();
        next.getCompletedPhases().add(next.getPhase());
        next.setUpdatedAt(Instant.now(clock));
        store.save(next);
        state = next;
        log.debug("Phase '{}' marked complete", next.getPhase().tag());
    }

    /** Stats of the current phase's completion; replaces stats of an earlier completion of the same phase. */
    public synchronized void recordPhaseSummary(ImportPhase phase, PhaseSummary summary) {
        CheckpointState next = requireState().copy();
        next.getPhaseSummaries().put(phase.tag(), summary);
        next.setUpdatedAt(Instant.now(clock));
        store.save(next);
        state = next;
    }

    /**
     * First phase in declared order not yet completed whose dependencies are all completed.
     * Without a checkpoint this is the first declared phase.
     */
    public synchronized Optional<ImportPhase> getNextPhase() {
        if (state == null) {
            return Optional.of(ImportPhase.first());
        }
        return ImportPhase.nextEligible(state.getCompletedPhases());
    }

    public synchronized void recordError(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        recordError(message);
    }

    /** Sets lastError and persists immediately. */
    public synchronized void recordError(String message) {
        CheckpointState next = requireState().copy();
        next.setLastError(message);
        next.setUpdatedAt(Instant.now(clock));
        store.save(next);
        state = next;
    }

    /** Deletes the persisted state. */
    public synchronized void reset() {
        store.delete();
        state = null;
        log.info("Checkpoint cleared at {}", store.describe());
    }

    /** Writes the in-memory state synchronously; no-op without a state. */
    public synchronized void flush() {
        if (state != null) {
            store.save(state);
        }
    }

    public synchronized Optional<ProgressSummary> getProgressSummary() {
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(ProgressSummary.of(state, Duration.between(state.getCreatedAt(), Instant.now(clock))));
    }

    /** Snapshot of the current state. */
    public synchronized Optional<CheckpointState> getState() {
        return Optional.ofNullable(state).map(CheckpointState::copy);
    }

    public synchronized boolean isPhaseCompleted(ImportPhase phase) {
        return state != null && state.isCompleted(phase);
    }

    public synchronized boolean isComplete() {
        return state != null && state.getCompletedPhases().size() == ImportPhase.values().length;
    }

    /**
     * Manager over an in-memory copy of the persisted state; nothing it does reaches the persisted checkpoint.
     */
    public synchronized CheckpointManager detachedCopy() {
        CheckpointState persisted = store.load().orElse(null);
        return new CheckpointManager(new InMemoryCheckpointStore(persisted), clock);
    }

    public String describeStore() {
        return store.describe();
    }

    private CheckpointState requireState() {
        if (state == null) {
            throw new IllegalStateException("No checkpoint loaded; call load(), create() or loadOrCreate() first");
        }
        return state;
    }

    /** {@code import-<base36 epoch millis>-<6 random base36 chars>}. */
    static String newRunId(Instant now) {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(BASE36.charAt(RANDOM.nextInt(BASE36.length())));
        }
        return "import-" + Long.toString(now.toEpochMilli(), 36) + "-" + suffix;
    }
}
