package com.capitolsync.importer.checkpoint;

import com.capitolsync.common.DurationFormat;
import com.capitolsync.importer.phase.ImportPhase;

import java.time.Duration;
import java.util.List;

/**
 * Read-only progress view derived from the checkpoint.
 */
public record ProgressSummary(
        String runId,
        ImportPhase phase,
        int progressPercent,
        Duration elapsed,
        List<ImportPhase> completedPhases,
        int totalPhases
) {

    public static ProgressSummary of(CheckpointState state, Duration elapsed) {
        return new ProgressSummary(
                state.getRunId(),
                state.getPhase(),
                percent(state.getRecordsProcessed(), state.getTotalExpected()),
                elapsed.isNegative() ? Duration.ZERO : elapsed,
                List.copyOf(state.getCompletedPhases()),
                ImportPhase.values().length);
    }

    /** round(processed / expected * 100); 0 when nothing is expected. */
    public static int percent(long processed, long expected) {
        if (expected <= 0) {
            return 0;
        }
        return (int) Math.round(processed * 100.0 / expected);
    }

    public String elapsedText() {
        return DurationFormat.format(elapsed);
    }

    public int completedCount() {
        return completedPhases.size();
    }
}
