package com.capitolsync.importer.phases;

import com.capitolsync.domain.Bill;
import com.capitolsync.importer.batch.BatchJob;
import com.capitolsync.importer.batch.BatchStats;
import com.capitolsync.importer.batch.BatchUpsertEngine;
import com.capitolsync.importer.batch.PhaseThresholds;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.run.PhaseImporter;
import com.capitolsync.importer.run.RunContext;
import com.capitolsync.ingestion.client.CongressApiClient;
import com.capitolsync.ingestion.client.model.BillListItem;
import com.capitolsync.ingestion.store.IdempotentBillStore;
import com.capitolsync.ingestion.transform.BillTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Imports bills for every configured congress and bill type, in declared order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillsImporter implements PhaseImporter {

    private final CongressApiClient client;
    private final BillTransformer transformer;
    private final IdempotentBillStore store;
    private final BatchUpsertEngine engine;
    private final ImporterProperties properties;

    @Override
    public ImportPhase phase() {
        return ImportPhase.BILLS;
    }

    @Override
    public void execute(ImportOptions options, RunContext context) {
        long start = System.currentTimeMillis();
        ImporterProperties.PhaseSettings settings = properties.settingsFor(phase());
        long expected = expectedTotal(settings);
        context.checkpoint().update(CheckpointUpdate.builder().totalExpected(expected).build());

        CrossProductRun<String> run = new CrossProductRun<>(properties.getCongresses(), properties.getBillTypes(),
                CrossProductRun.BILL_TYPE);
        BatchStats stats = run.run(options, properties.getDryRunMaxRecords(), context,
                (congress, billType, startOffset, processedBefore, limit) -> {
                    BatchJob<BillListItem, Bill> job = BatchJob.<BillListItem, Bill>builder("C" + congress + "/" + billType)
                            .records(() -> client.listBills(congress, billType, settings.getPageSize()))
                            .batchSize(settings.getBatchSize())
                            .resumeOffset(startOffset)
                            .processedBefore(processedBefore)
                            .recordLimit(limit)
                            .transform(transformer::transform)
                            .upsert(store::upsert)
                            .describe(item -> item.type() + " " + item.number())
                            .build();
                    return engine.run(job, options, context);
                });

        PhaseThresholds.check(phase(), settings, PhaseCursor.recordsProcessed(context), expected, options.dryRun());
        long durationMs = System.currentTimeMillis() - start;
        context.checkpoint().recordPhaseSummary(phase(), stats.toSummary(durationMs));
        PhaseReport.log(phase(), stats, durationMs);
    }

    private long expectedTotal(ImporterProperties.PhaseSettings settings) {
        long sum = properties.getCongresses().stream().mapToLong(properties::estimatedBills).sum();
        return sum > 0 ? sum : settings.getEstimatedTotal();
    }
}
