package com.capitolsync.importer.phases;

import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.run.RunContext;

/**
 * Resume position of a flat (single-dimension) phase, read once when the importer starts.
 *
 * @param offset          records of the phase already committed
 * @param processedBefore recordsProcessed not covered by {@code offset}
 */
record PhaseCursor(long offset, long processedBefore) {

    static PhaseCursor of(RunContext context) {
        CheckpointState state = context.checkpoint().getState()
                .orElseThrow(() -> new IllegalStateException("No checkpoint loaded"));
        return new PhaseCursor(state.getOffset(), Math.max(0, state.getRecordsProcessed() - state.getOffset()));
    }

    static long recordsProcessed(RunContext context) {
        return context.checkpoint().getState().map(CheckpointState::getRecordsProcessed).orElse(0L);
    }
}
