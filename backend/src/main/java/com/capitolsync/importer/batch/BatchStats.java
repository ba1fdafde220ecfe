package com.capitolsync.importer.batch;

import com.capitolsync.importer.checkpoint.PhaseSummary;
import lombok.Getter;

/**
 * Counters of one or more batch engine runs. {@code processed} counts every record of a processed batch,
 * whatever its outcome; {@code skippedAhead} counts records of batches skipped on resume.
 */
@Getter
public class BatchStats {

    private long seen;
    private long skippedAhead;
    private long processed;
    private long created;
    private long updated;
    /** Records the transform declined (returned null). */
    private long skipped;
    private long transformErrors;
    private long upsertErrors;

    void batchSkipped(int size) {
        seen += size;
        skippedAhead += size;
    }

    void batchProcessed(int size) {
        seen += size;
        processed += size;
    }

    void recordCreated() {
        created++;
    }

    void recordUpdated() {
        updated++;
    }

    void recordSkipped() {
        skipped++;
    }

    void transformFailed() {
        transformErrors++;
    }

    void upsertFailed() {
        upsertErrors++;
    }

    public long errors() {
        return transformErrors + upsertErrors;
    }

    public BatchStats add(BatchStats other) {
        seen += other.seen;
        skippedAhead += other.skippedAhead;
        processed += other.processed;
        created += other.created;
        updated += other.updated;
        skipped += other.skipped;
        transformErrors += other.transformErrors;
        upsertErrors += other.upsertErrors;
        return this;
    }

    public PhaseSummary toSummary(long durationMs) {
        return new PhaseSummary(created, updated, skipped + skippedAhead, errors(), durationMs);
    }

    @Override
    public String toString() {
        return "processed=" + processed + ", created=" + created + ", updated=" + updated
                + ", skipped=" + (skipped + skippedAhead) + ", errors=" + errors();
    }
}
