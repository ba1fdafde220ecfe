package com.capitolsync.importer.run;

import com.capitolsync.importer.batch.BatchJob;
import com.capitolsync.importer.batch.BatchUpsertEngine;
import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointPersistException;
import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.checkpoint.InMemoryCheckpointStore;
import com.capitolsync.importer.checkpoint.JsonFileCheckpointStore;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.phase.PhaseDependencyException;
import com.capitolsync.ingestion.client.CongressApiException;
import com.capitolsync.ingestion.store.UpsertResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportOrchestratorTest {

    @TempDir
    Path dir;

    private CheckpointManager checkpoint;
    private RunContext context;
    private final List<ImportPhase> executed = new ArrayList<>();
    private final AtomicReference<BiConsumer<ImportPhase, RunContext>> behaviour =
            new AtomicReference<>((phase, ctx) -> { });
    private ImportOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        JsonFileCheckpointStore store = new JsonFileCheckpointStore(new ObjectMapper().findAndRegisterModules(), dir,
                "import-checkpoint.json", "import-checkpoint.backup.json");
        checkpoint = new CheckpointManager(store);
        checkpoint.create();
        context = RunContext.detached(checkpoint);
        List<PhaseImporter> importers = Arrays.stream(ImportPhase.values()).map(this::recording).toList();
        orchestrator = new ImportOrchestrator(new PhaseImporterRegistry(importers));
    }

    @Test
    @DisplayName("unmet dependency fails without touching the checkpoint file")
    void dependencyErrorLeavesCheckpointUnchanged() throws IOException {
        byte[] before = Files.readAllBytes(dir.resolve("import-checkpoint.json"));

        assertThatThrownBy(() -> orchestrator.executePhase(ImportPhase.VOTES, ImportOptions.defaults(), context))
                .isInstanceOf(PhaseDependencyException.class)
                .satisfies(e -> assertThat(((PhaseDependencyException) e).getMissing())
                        .containsExactly(ImportPhase.LEGISLATORS, ImportPhase.BILLS));

        assertThat(Files.readAllBytes(dir.resolve("import-checkpoint.json"))).isEqualTo(before);
        assertThat(executed).isEmpty();
    }

    @Test
    void executeAllRunsEveryPhaseInOrder() {
        orchestrator.executeAll(ImportOptions.defaults(), context);

        assertThat(executed).containsExactly(ImportPhase.values());
        assertThat(checkpoint.isComplete()).isTrue();
        assertThat(checkpoint.getNextPhase()).isEmpty();
    }

    @Test
    @DisplayName("entering a new phase resets the cursor left by the previous one")
    void phaseTransitionResetsProgress() {
        checkpoint.update(CheckpointUpdate.builder().offset(300).recordsProcessed(540).totalExpected(550)
                .congress(118).billType("hr").build());
        checkpoint.completeCurrentPhase();
        AtomicReference<CheckpointState> seenAtStart = new AtomicReference<>();
        behaviour.set((phase, ctx) -> seenAtStart.set(ctx.checkpoint().getState().orElseThrow()));

        orchestrator.executePhase(ImportPhase.COMMITTEES, ImportOptions.defaults(), context);

        CheckpointState start = seenAtStart.get();
        assertThat(start.getPhase()).isEqualTo(ImportPhase.COMMITTEES);
        assertThat(start.getOffset()).isZero();
        assertThat(start.getRecordsProcessed()).isZero();
        assertThat(start.getTotalExpected()).isZero();
        assertThat(start.getCongress()).isNull();
        assertThat(start.getBillType()).isNull();
    }

    @Test
    @DisplayName("an interrupted phase resumes with its cursor and clears the last error")
    void interruptedPhaseResumes() {
        checkpoint.update(CheckpointUpdate.builder().offset(200).recordsProcessed(200).lastError("timeout").build());
        AtomicReference<CheckpointState> seenAtStart = new AtomicReference<>();
        behaviour.set((phase, ctx) -> seenAtStart.set(ctx.checkpoint().getState().orElseThrow()));

        orchestrator.executePhase(ImportPhase.LEGISLATORS, ImportOptions.defaults(), context);

        assertThat(seenAtStart.get().getOffset()).isEqualTo(200);
        assertThat(seenAtStart.get().getLastError()).isNull();
        assertThat(checkpoint.isPhaseCompleted(ImportPhase.LEGISLATORS)).isTrue();
    }

    @Test
    void failedPhaseRecordsErrorAndIsNotCompleted() {
        behaviour.set((phase, ctx) -> {
            throw new IllegalStateException("upstream unavailable");
        });

        assertThatThrownBy(() -> orchestrator.executeAll(ImportOptions.defaults(), context))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("upstream unavailable");

        CheckpointState state = checkpoint.getState().orElseThrow();
        assertThat(state.getLastError()).isEqualTo("upstream unavailable");
        assertThat(state.getCompletedPhases()).isEmpty();
        assertThat(executed).containsExactly(ImportPhase.LEGISLATORS);
    }

    @Test
    void cancelledRunStopsBeforeNextPhase() {
        behaviour.set((phase, ctx) -> ctx.cancel());

        assertThatThrownBy(() -> orchestrator.executeAll(ImportOptions.defaults(), context))
                .isInstanceOf(ImportCancelledException.class);

        assertThat(executed).containsExactly(ImportPhase.LEGISLATORS);
    }

    @Test
    @DisplayName("interruption inside a phase is not recorded as an error")
    void interruptionInsidePhaseKeepsCursor() {
        behaviour.set((phase, ctx) -> {
            ctx.checkpoint().update(CheckpointUpdate.builder().offset(100).recordsProcessed(100).build());
            ctx.cancel();
            ctx.throwIfCancelled();
        });

        assertThatThrownBy(() -> orchestrator.executeAll(ImportOptions.defaults(), context))
                .isInstanceOf(ImportCancelledException.class);

        CheckpointState state = checkpoint.getState().orElseThrow();
        assertThat(state.getLastError()).isNull();
        assertThat(state.getOffset()).isEqualTo(100);
        assertThat(state.getCompletedPhases()).isEmpty();
    }

    @Test
    @DisplayName("an upstream failure mid-phase is recorded and keeps the last committed offset")
    void fetchFailureRecordsErrorAndKeepsOffset() {
        BatchUpsertEngine engine = new BatchUpsertEngine(new ImporterProperties());
        behaviour.set((phase, ctx) -> engine.run(BatchJob.<Integer, Integer>builder(phase.tag())
                .records(() -> IntStream.range(0, 300).boxed().peek(i -> {
                    if (i == 150) {
                        throw new CongressApiException("Request to /member failed after 4 attempts: HTTP 503",
                                503, 0L, null);
                    }
                }))
                .batchSize(50)
                .transform(i -> i)
                .upsert(i -> UpsertResult.CREATED)
                .build(), ImportOptions.defaults(), ctx));

        assertThatThrownBy(() -> orchestrator.executeAll(ImportOptions.defaults(), context))
                .isInstanceOf(CongressApiException.class);

        CheckpointState state = checkpoint.getState().orElseThrow();
        assertThat(state.getLastError()).contains("HTTP 503");
        assertThat(state.getOffset()).isEqualTo(150);
        assertThat(state.getCompletedPhases()).isEmpty();
    }

    @Test
    @DisplayName("a checkpoint write failure aborts the phase")
    void checkpointWriteFailureAbortsPhase() {
        FailingStore store = new FailingStore();
        CheckpointManager failingCheckpoint = new CheckpointManager(store);
        failingCheckpoint.create();
        behaviour.set((phase, ctx) -> {
            store.failing = true;
            ctx.checkpoint().update(CheckpointUpdate.builder().offset(50).recordsProcessed(50).build());
        });

        assertThatThrownBy(() -> orchestrator.executePhase(ImportPhase.LEGISLATORS, ImportOptions.defaults(),
                RunContext.detached(failingCheckpoint)))
                .isInstanceOf(CheckpointPersistException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

        assertThat(failingCheckpoint.isPhaseCompleted(ImportPhase.LEGISLATORS)).isFalse();
        assertThat(failingCheckpoint.getState().orElseThrow().getOffset()).isZero();
    }

    @Test
    void errorInsidePhaseIsRecorded() {
        behaviour.set((phase, ctx) -> {
            throw new StackOverflowError("transformer recursion");
        });

        assertThatThrownBy(() -> orchestrator.executeAll(ImportOptions.defaults(), context))
                .isInstanceOf(StackOverflowError.class);

        assertThat(checkpoint.getState().orElseThrow().getLastError()).isEqualTo("transformer recursion");
    }

    private PhaseImporter recording(ImportPhase phase) {
        return new PhaseImporter() {
            @Override
            public ImportPhase phase() {
                return phase;
            }

            @Override
            public void execute(ImportOptions options, RunContext ctx) {
                executed.add(phase);
                behaviour.get().accept(phase, ctx);
            }
        };
    }

    private static class FailingStore extends InMemoryCheckpointStore {

        boolean failing;

        @Override
        public synchronized void save(CheckpointState state) {
            if (failing) {
                throw new CheckpointPersistException("Failed to write checkpoint: disk full", null);
            }
            super.save(state);
        }
    }
}
