package com.capitolsync.importer.phases;

import com.capitolsync.domain.Committee;
import com.capitolsync.importer.batch.BatchUpsertEngine;
import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.checkpoint.InMemoryCheckpointStore;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.run.RunContext;
import com.capitolsync.ingestion.client.CongressApiClient;
import com.capitolsync.ingestion.client.model.CommitteeListItem;
import com.capitolsync.ingestion.store.IdempotentCommitteeStore;
import com.capitolsync.ingestion.store.UpsertResult;
import com.capitolsync.ingestion.transform.CommitteeTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CommitteesImporterTest {

    @Mock private CongressApiClient client;
    @Mock private IdempotentCommitteeStore store;

    private CheckpointManager checkpoint;
    private RunContext context;
    private CommitteesImporter importer;

    @BeforeEach
    void setUp() {
        ImporterProperties properties = new ImporterProperties();
        properties.getCommittees().setMinRecords(0);
        importer = new CommitteesImporter(client, new CommitteeTransformer(), store,
                new BatchUpsertEngine(properties), properties);

        checkpoint = new CheckpointManager(new InMemoryCheckpointStore());
        checkpoint.create();
        checkpoint.update(CheckpointUpdate.enterPhase(ImportPhase.COMMITTEES));
        context = RunContext.detached(checkpoint);

        when(client.listCommittees(anyInt())).thenAnswer(i -> Stream.of(
                new CommitteeListItem("hsag15", "Subcommittee on Forestry", "House", "Subcommittee",
                        new CommitteeListItem.ParentRef("hsag00", "Agriculture"), null),
                new CommitteeListItem("hsag00", "Committee on Agriculture", "House", "Standing", null, null),
                new CommitteeListItem("ssju00", "Committee on the Judiciary", "Senate", "Standing", null, null)));
        when(store.upsert(any(Committee.class))).thenReturn(UpsertResult.CREATED);
    }

    @Test
    void parentsAreUpsertedBeforeSubcommitteesThenLinked() {
        when(store.linkPendingParents()).thenReturn(0);

        importer.execute(ImportOptions.defaults(), context);

        ArgumentCaptor<Committee> captor = ArgumentCaptor.forClass(Committee.class);
        InOrder order = inOrder(store);
        order.verify(store, times(3)).upsert(captor.capture());
        order.verify(store).linkPendingParents();
        assertThat(captor.getAllValues()).extracting(Committee::getId).containsExactly("hsag00", "ssju00", "hsag15");
        assertThat(captor.getAllValues().get(2).getParentId()).isEqualTo("hsag00");
        assertThat(checkpoint.getState().orElseThrow().getTotalExpected()).isEqualTo(3);
    }

    @Test
    void dryRunDoesNotRelinkParents() {
        importer.execute(new ImportOptions(true, false, false, true), context);

        verify(store, never()).linkPendingParents();
        verify(store, never()).upsert(any(Committee.class));
    }
}
