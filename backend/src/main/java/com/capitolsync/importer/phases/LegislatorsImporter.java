package com.capitolsync.importer.phases;

import com.capitolsync.domain.Legislator;
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
import com.capitolsync.ingestion.client.model.MemberListItem;
import com.capitolsync.ingestion.store.IdempotentLegislatorStore;
import com.capitolsync.ingestion.transform.LegislatorTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Imports current members, then historical members, as one ordered sequence.
 * Historical members are left out of dry runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegislatorsImporter implements PhaseImporter {

    private final CongressApiClient client;
    private final LegislatorTransformer transformer;
    private final IdempotentLegislatorStore store;
    private final BatchUpsertEngine engine;
    private final ImporterProperties properties;

    @Override
    public ImportPhase phase() {
        return ImportPhase.LEGISLATORS;
    }

    @Override
    public void execute(ImportOptions options, RunContext context) {
        long start = System.currentTimeMillis();
        ImporterProperties.PhaseSettings settings = properties.settingsFor(phase());
        PhaseCursor cursor = PhaseCursor.of(context);
        context.checkpoint().update(CheckpointUpdate.builder().totalExpected(settings.getEstimatedTotal()).build());

        BatchJob<Member, Legislator> job = BatchJob.<Member, Legislator>builder("legislators")
                .records(() -> members(settings.getPageSize(), options.dryRun()))
                .batchSize(settings.getBatchSize())
                .resumeOffset(cursor.offset())
                .processedBefore(cursor.processedBefore())
                .recordLimit(options.dryRun() ? properties.getDryRunMaxRecords() : Long.MAX_VALUE)
                .transform(member -> transformer.transform(member.item(), member.current()))
                .upsert(store::upsert)
                .describe(member -> member.item().bioguideId())
                .build();
        BatchStats stats = engine.run(job, options, context);

        PhaseThresholds.check(phase(), settings, PhaseCursor.recordsProcessed(context), settings.getEstimatedTotal(),
                options.dryRun());
        long durationMs = System.currentTimeMillis() - start;
        context.checkpoint().recordPhaseSummary(phase(), stats.toSummary(durationMs));
        PhaseReport.log(phase(), stats, durationMs);
    }

    private Stream<Member> members(int pageSize, boolean dryRun) {
        Stream<Member> current = client.listMembers(true, pageSize).map(item -> new Member(item, true));
        if (dryRun) {
            return current;
        }
        Stream<Member> historical = client.listMembers(false, pageSize).map(item -> new Member(item, false));
        return Stream.concat(current, historical);
    }

    record Member(MemberListItem item, boolean current) {
    }
}
