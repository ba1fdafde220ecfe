package com.capitolsync.importer.phases;

import com.capitolsync.common.DurationFormat;
import com.capitolsync.importer.batch.BatchStats;
import com.capitolsync.importer.phase.ImportPhase;
import lombok.extern.slf4j.Slf4j;

/**
 * Summary block logged at the end of each import phase.
 */
@Slf4j
final class PhaseReport {

    private PhaseReport() {
    }

    static void log(ImportPhase phase, BatchStats stats, long durationMs) {
        double seconds = Math.max(1, durationMs) / 1000.0;
        log.info("=== {} import summary ===", phase.tag());
        log.info("Processed: {} | Created: {} | Updated: {} | Skipped: {} | Errors: {}",
                stats.getProcessed(), stats.getCreated(), stats.getUpdated(),
                stats.getSkipped() + stats.getSkippedAhead(), stats.errors());
        log.info("Duration: {} ({} records/s)", DurationFormat.formatMillis(durationMs),
                String.format("%.1f", stats.getProcessed() / seconds));
    }
}
