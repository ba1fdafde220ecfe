package com.capitolsync.importer.phases;

import com.capitolsync.domain.Committee;
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
import com.capitolsync.ingestion.client.model.CommitteeListItem;
import com.capitolsync.ingestion.store.IdempotentCommitteeStore;
import com.capitolsync.ingestion.transform.CommitteeTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Stream;

/**
 * Imports committees with parents ahead of subcommittees, then links subcommittees whose parent
 * was not stored yet when they were upserted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommitteesImporter implements PhaseImporter {

    private final CongressApiClient client;
    private final CommitteeTransformer transformer;
    private final IdempotentCommitteeStore store;
    private final BatchUpsertEngine engine;
    private final ImporterProperties properties;

    @Override
    public ImportPhase phase() {
        return ImportPhase.COMMITTEES;
    }

    @Override
    public void execute(ImportOptions options, RunContext context) {
        long start = System.currentTimeMillis();
        ImporterProperties.PhaseSettings settings = properties.settingsFor(phase());
        PhaseCursor cursor = PhaseCursor.of(context);

        List<CommitteeListItem> fetched;
        try (Stream<CommitteeListItem> stream = client.listCommittees(settings.getPageSize())) {
            fetched = stream.toList();
        }
        List<CommitteeListItem> ordered = CommitteeTransformer.parentsFirst(fetched);
        log.info("Fetched {} committees", ordered.size());
        context.checkpoint().update(CheckpointUpdate.builder().totalExpected(ordered.size()).build());

        BatchJob<CommitteeListItem, Committee> job = BatchJob.<CommitteeListItem, Committee>builder("committees")
                .records(ordered::stream)
                .batchSize(settings.getBatchSize())
                .resumeOffset(cursor.offset())
                .processedBefore(cursor.processedBefore())
                .recordLimit(options.dryRun() ? properties.getDryRunMaxRecords() : Long.MAX_VALUE)
                .transform(transformer::transform)
                .upsert(store::upsert)
                .describe(CommitteeListItem::systemCode)
                .build();
        BatchStats stats = engine.run(job, options, context);

        if (!options.dryRun()) {
            int linked = store.linkPendingParents();
            if (linked > 0) {
                log.info("Linked {} subcommittees to their parent committee", linked);
            }
        }

        PhaseThresholds.check(phase(), settings, PhaseCursor.recordsProcessed(context), settings.getEstimatedTotal(),
                options.dryRun());
        long durationMs = System.currentTimeMillis() - start;
        context.checkpoint().recordPhaseSummary(phase(), stats.toSummary(durationMs));
        PhaseReport.log(phase(), stats, durationMs);
    }
}
