package com.capitolsync.importer.batch;

import com.capitolsync.ingestion.store.UpsertResult;

import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * One run of the batch engine over a single iteration context (a phase, or one cell of a cross-product phase).
 *
 * @param label           context shown in logs, e.g. {@code bills C118/hr}
 * @param records         lazy ordered source; opened once and closed by the engine
 * @param batchSize       records per checkpoint write
 * @param resumeOffset    records of this context already committed by an earlier run
 * @param processedBefore phase-wide recordsProcessed excluding this context
 * @param recordLimit     stop once this many records were processed (dry-run cap); {@link Long#MAX_VALUE} for none
 * @param transform       raw record to domain record; may throw, may return null to skip the record
 * @param upsert          idempotent write of one domain record
 * @param describe        raw record identity for failure logs
 */
public record BatchJob<R, D>(
        String label,
        Supplier<Stream<R>> records,
        int batchSize,
        long resumeOffset,
        long processedBefore,
        long recordLimit,
        Function<R, D> transform,
        Function<D, UpsertResult> upsert,
        Function<R, String> describe
) {

    public static <R, D> Builder<R, D> builder(String label) {
        return new Builder<>(label);
    }

    public static final class Builder<R, D> {

        private final String label;
        private Supplier<Stream<R>> records;
        private int batchSize = 50;
        private long resumeOffset;
        private long processedBefore;
        private long recordLimit = Long.MAX_VALUE;
        private Function<R, D> transform;
        private Function<D, UpsertResult> upsert;
        private Function<R, String> describe = String::valueOf;

        private Builder(String label) {
            this.label = label;
        }

        public Builder<R, D> records(Supplier<Stream<R>> records) {
            this.records = records;
            return this;
        }

        public Builder<R, D> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder<R, D> resumeOffset(long resumeOffset) {
            this.resumeOffset = resumeOffset;
            return this;
        }

        public Builder<R, D> processedBefore(long processedBefore) {
            this.processedBefore = processedBefore;
            return this;
        }

        public Builder<R, D> recordLimit(long recordLimit) {
            this.recordLimit = recordLimit;
            return this;
        }

        public Builder<R, D> transform(Function<R, D> transform) {
            this.transform = transform;
            return this;
        }

        public Builder<R, D> upsert(Function<D, UpsertResult> upsert) {
            this.upsert = upsert;
            return this;
        }

        public Builder<R, D> describe(Function<R, String> describe) {
            this.describe = describe;
            return this;
        }

        public BatchJob<R, D> build() {
            if (records == null || transform == null || upsert == null) {
                throw new IllegalStateException("records, transform and upsert are required for " + label);
            }
            if (resumeOffset < 0 || processedBefore < 0) {
                throw new IllegalStateException("negative resume position for " + label);
            }
            return new BatchJob<>(label, records, batchSize, resumeOffset, processedBefore, recordLimit,
                    transform, upsert, describe);
        }
    }
}
