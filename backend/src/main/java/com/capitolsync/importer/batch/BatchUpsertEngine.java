package com.capitolsync.importer.batch;

import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.checkpoint.ProgressSummary;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.run.RunContext;
import com.capitolsync.ingestion.store.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Consumes a lazy record stream in fixed-size batches with skip-ahead resume.
 * <ul>
 *   <li>A batch lying entirely within the first {@code resumeOffset} records is counted and skipped.</li>
 *   <li>Otherwise each record is transformed and upserted on its own; failures are logged and counted.</li>
 *   <li>After each processed batch the checkpoint offset and recordsProcessed advance by the batch size.</li>
 * </ul>
 * A crash therefore redoes at most one batch, which idempotent upserts make safe.
 * In a dry run nothing is upserted and processing stops at the job's record limit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchUpsertEngine {

    private static final int PROGRESS_BAR_WIDTH = 30;

    private final ImporterProperties properties;

    public <R, D> BatchStats run(BatchJob<R, D> job, ImportOptions options, RunContext context) {
        BatchStats stats = new BatchStats();
        long nextProgressLog = properties.getProgressLogInterval();
        if (job.resumeOffset() > 0) {
            log.info("[{}] resuming: skipping batches before offset {}", job.label(), job.resumeOffset());
        }
        try (Stream<R> records = job.records().get()) {
            Iterator<List<R>> batches = Batches.of(records.iterator(), job.batchSize());
            while (stats.getProcessed() < job.recordLimit() && batches.hasNext()) {
                context.throwIfCancelled();
                List<R> batch = batches.next();
                if (stats.getSeen() + batch.size() <= job.resumeOffset()) {
                    stats.batchSkipped(batch.size());
                    continue;
                }
                for (R raw : batch) {
                    processRecord(job, raw, options, stats);
                }
                stats.batchProcessed(batch.size());
                CheckpointState state = context.checkpoint().update(CheckpointUpdate.builder()
                        .offset(stats.getSeen())
                        .recordsProcessed(job.processedBefore() + stats.getSeen())
                        .build());
                if (options.verbose()) {
                    log.info("[{}] batch of {} committed, offset {}", job.label(), batch.size(), stats.getSeen());
                }
                if (options.verbose() || state.getRecordsProcessed() >= nextProgressLog) {
                    logProgress(job.label(), state);
                    nextProgressLog = state.getRecordsProcessed() + properties.getProgressLogInterval();
                }
            }
        }
        if (stats.getProcessed() >= job.recordLimit()) {
            log.info("[{}] dry run limit of {} records reached", job.label(), job.recordLimit());
        }
        if (stats.getSkippedAhead() > 0) {
            log.info("[{}] skipped {} already imported records", job.label(), stats.getSkippedAhead());
        }
        log.info("[{}] done: {}", job.label(), stats);
        return stats;
    }

    private <R, D> void processRecord(BatchJob<R, D> job, R raw, ImportOptions options, BatchStats stats) {
        D record;
        try {
            record = job.transform().apply(raw);
        } catch (RuntimeException e) {
            stats.transformFailed();
            log.warn("[{}] transform failed for {}: {}", job.label(), describe(job, raw), e.getMessage());
            return;
        }
        if (record == null) {
            stats.recordSkipped();
            return;
        }
        if (options.dryRun()) {
            return;
        }
        try {
            UpsertResult result = job.upsert().apply(record);
            if (result.created()) {
                stats.recordCreated();
            } else {
                stats.recordUpdated();
            }
        } catch (RuntimeException e) {
            stats.upsertFailed();
            log.warn("[{}] upsert failed for {}: {}", job.label(), describe(job, raw), e.getMessage());
        }
    }

    private static <R> String describe(BatchJob<R, ?> job, R raw) {
        try {
            return job.describe().apply(raw);
        } catch (RuntimeException e) {
            return String.valueOf(raw);
        }
    }

    private static void logProgress(String label, CheckpointState state) {
        int percent = Math.min(100, ProgressSummary.percent(state.getRecordsProcessed(), state.getTotalExpected()));
        log.info("{} {}% ({}/{}) [{}]", progressBar(percent), percent,
                state.getRecordsProcessed(), state.getTotalExpected(), label);
    }

    static String progressBar(int percent) {
        int filled = Math.max(0, Math.min(PROGRESS_BAR_WIDTH, percent * PROGRESS_BAR_WIDTH / 100));
        return "[" + "#".repeat(filled) + "-".repeat(PROGRESS_BAR_WIDTH - filled) + "]";
    }
}
