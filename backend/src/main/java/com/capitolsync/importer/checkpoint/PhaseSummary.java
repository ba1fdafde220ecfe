package com.capitolsync.importer.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Statistics recorded when a phase completes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhaseSummary(long created, long updated, long skipped, long errorCount, long durationMs) {
}
