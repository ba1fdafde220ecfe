package com.capitolsync.importer.phases;

import com.capitolsync.importer.batch.BatchStats;
import com.capitolsync.importer.batch.CrossProductCursor;
import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.run.RunContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Drives a congress × inner-dimension phase cell by cell. The inner position is stored in
 * {@code billType} or {@code session} through {@link InnerKey}; {@code offset} is local to the current cell
 * while {@code recordsProcessed} keeps counting across cells.
 */
@Slf4j
final class CrossProductRun<I> {

    /** Where the inner dimension lives in the checkpoint. */
    interface InnerKey<I> {

        I read(CheckpointState state);

        void write(CheckpointUpdate.Builder update, I value);
    }

    static final InnerKey<String> BILL_TYPE = new InnerKey<String>() {
        @Override
        public String read(CheckpointState state) {
            return state.getBillType();
        }

        @Override
        public void write(CheckpointUpdate.Builder update, String value) {
            update.billType(value);
        }
    };

    static final InnerKey<Integer> SESSION = new InnerKey<Integer>() {
        @Override
        public Integer read(CheckpointState state) {
            return state.getSession();
        }

        @Override
        public void write(CheckpointUpdate.Builder update, Integer value) {
            update.session(value);
        }
    };

    /** Processes one cell and returns its stats. */
    interface CellImporter<I> {

        BatchStats importCell(int congress, I inner, long startOffset, long processedBefore, long recordLimit);
    }

    private final List<Integer> congresses;
    private final List<I> inner;
    private final InnerKey<I> key;

    CrossProductRun(List<Integer> congresses, List<I> inner, InnerKey<I> key) {
        this.congresses = congresses;
        this.inner = inner;
        this.key = key;
    }

    BatchStats run(ImportOptions options, long dryRunMaxRecords, RunContext context, CellImporter<I> cellImporter) {
        CheckpointState start = requireState(context);
        CrossProductCursor<Integer, I> cursor = new CrossProductCursor<>(congresses, inner,
                start.getCongress(), key.read(start), start.getOffset());
        BatchStats total = new BatchStats();

        for (CrossProductCursor.Cell<Integer, I> cell : cursor.cells()) {
            context.throwIfCancelled();
            int congress = cell.outer();
            I value = cell.inner();
            if (cursor.shouldSkip(congress, value)) {
                log.debug("Skipping completed cell C{}/{}", congress, value);
                continue;
            }
            long remaining = options.dryRun() ? dryRunMaxRecords - total.getProcessed() : Long.MAX_VALUE;
            if (remaining <= 0) {
                break;
            }
            if (!cursor.isResumeCell(congress, value)) {
                CheckpointUpdate.Builder enter = CheckpointUpdate.builder().congress(congress).offset(0);
                key.write(enter, value);
                context.checkpoint().update(enter.build());
            }
            long startOffset = cursor.startOffset(congress, value);
            long processedBefore = Math.max(0, requireState(context).getRecordsProcessed() - startOffset);
            log.info("Importing C{}/{}{}", congress, value, startOffset > 0 ? " from offset " + startOffset : "");
            total.add(cellImporter.importCell(congress, value, startOffset, processedBefore, remaining));
        }
        return total;
    }

    private static CheckpointState requireState(RunContext context) {
        return context.checkpoint().getState()
                .orElseThrow(() -> new IllegalStateException("No checkpoint loaded"));
    }
}
