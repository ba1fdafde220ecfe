package com.capitolsync.importer.phases;

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
import com.capitolsync.ingestion.client.model.HouseVoteListItem;
import com.capitolsync.ingestion.store.IdempotentRollCallStore;
import com.capitolsync.ingestion.store.IdempotentRollCallStore.PositionCounts;
import com.capitolsync.ingestion.store.IdempotentRollCallStore.RollCallOutcome;
import com.capitolsync.ingestion.transform.RollCallBundle;
import com.capitolsync.ingestion.transform.RollCallVoteTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Imports House roll calls for every configured congress and session. The transform step fetches the
 * roll-call detail, so a failed detail request only costs that one roll call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VotesImporter implements PhaseImporter {

    private final CongressApiClient client;
    private final RollCallVoteTransformer transformer;
    private final IdempotentRollCallStore store;
    private final BatchUpsertEngine engine;
    private final ImporterProperties properties;

    @Override
    public ImportPhase phase() {
        return ImportPhase.VOTES;
    }

    @Override
    public void execute(ImportOptions options, RunContext context) {
        long start = System.currentTimeMillis();
        ImporterProperties.PhaseSettings settings = properties.settingsFor(phase());
        long expected = expectedTotal(settings);
        context.checkpoint().update(CheckpointUpdate.builder().totalExpected(expected).build());
        AtomicReference<PositionCounts> positions = new AtomicReference<>(PositionCounts.NONE);

        CrossProductRun<Integer> run = new CrossProductRun<>(properties.getCongresses(), properties.getVoteSessions(),
                CrossProductRun.SESSION);
        BatchStats stats = run.run(options, properties.getDryRunMaxRecords(), context,
                (congress, session, startOffset, processedBefore, limit) -> {
                    BatchJob<HouseVoteListItem, RollCallBundle> job =
                            BatchJob.<HouseVoteListItem, RollCallBundle>builder("C" + congress + "/session " + session)
                                    .records(() -> client.listHouseVotes(congress, session, settings.getPageSize()))
                                    .batchSize(settings.getBatchSize())
                                    .resumeOffset(startOffset)
                                    .processedBefore(processedBefore)
                                    .recordLimit(limit)
                                    .transform(item -> transformer.transform(
                                            client.getHouseVoteDetail(congress, session, item.rollCallNumber())))
                                    .upsert(bundle -> {
                                        RollCallOutcome outcome = store.upsert(bundle);
                                        positions.updateAndGet(counts -> counts.plus(outcome.positions()));
                                        return outcome.rollCall();
                                    })
                                    .describe(item -> "roll " + item.rollCallNumber())
                                    .build();
                    return engine.run(job, options, context);
                });

        PositionCounts totals = positions.get();
        log.info("Vote positions: {} created, {} updated, {} skipped (unknown legislator)",
                totals.created(), totals.updated(), totals.skipped());
        PhaseThresholds.check(phase(), settings, PhaseCursor.recordsProcessed(context), expected, options.dryRun());
        long durationMs = System.currentTimeMillis() - start;
        context.checkpoint().recordPhaseSummary(phase(), stats.toSummary(durationMs));
        PhaseReport.log(phase(), stats, durationMs);
    }

    private long expectedTotal(ImporterProperties.PhaseSettings settings) {
        long sum = properties.getCongresses().stream().mapToLong(properties::estimatedVotes).sum();
        return sum > 0 ? sum : settings.getEstimatedTotal();
    }
}
