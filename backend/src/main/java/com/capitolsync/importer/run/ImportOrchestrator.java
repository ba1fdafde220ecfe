package com.capitolsync.importer.run;

import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointPersistException;
import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.phase.PhaseDependencyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Drives phases in dependency order and owns the phase-transition rules of the checkpoint.
 * A failed phase is recorded and rethrown; it is never retried here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportOrchestrator {

    private final PhaseImporterRegistry registry;

    /**
     * Run all remaining phases until none is eligible.
     */
    public void executeAll(ImportOptions options, RunContext context) {
        CheckpointManager checkpoint = context.checkpoint();
        Optional<ImportPhase> next = checkpoint.getNextPhase();
        while (next.isPresent()) {
            context.throwIfCancelled();
            executePhase(next.get(), options, context);
            next = checkpoint.getNextPhase();
        }
        log.info("No eligible phase remaining");
    }

    /**
     * Run one phase after checking its dependencies.
     *
     * @throws PhaseDependencyException when a dependency has not completed; the checkpoint is left untouched
     */
    public void executePhase(ImportPhase phase, ImportOptions options, RunContext context) {
        CheckpointManager checkpoint = context.checkpoint();
        CheckpointState state = checkpoint.getState()
                .orElseThrow(() -> new IllegalStateException("No checkpoint loaded"));

        List<ImportPhase> missing = phase.missingDependencies(state.getCompletedPhases());
        if (!missing.isEmpty()) {
            throw new PhaseDependencyException(phase, missing);
        }

        if (isInterruptedRunOf(state, phase)) {
            log.info("Resuming phase '{}' at offset {} ({} records processed)",
                    phase.tag(), state.getOffset(), state.getRecordsProcessed());
            checkpoint.update(CheckpointUpdate.builder().lastError(null).build());
        } else {
            checkpoint.update(CheckpointUpdate.enterPhase(phase));
        }

        log.info("--- Phase: {} ---", phase.tag());
        try {
            registry.get(phase).execute(options, context);
            checkpoint.completeCurrentPhase();
            log.info("Phase '{}' completed", phase.tag());
        } catch (ImportCancelledException e) {
            log.warn("Phase '{}' interrupted at offset {}", phase.tag(),
                    checkpoint.getState().map(CheckpointState::getOffset).orElse(0L));
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Phase '{}' failed: {}", phase.tag(), e.toString());
            recordFailure(checkpoint, e);
            throw e;
        }
    }

    /** Same phase, some progress, not completed: resume instead of resetting the cursor. */
    private static boolean isInterruptedRunOf(CheckpointState state, ImportPhase phase) {
        return state.getPhase() == phase && state.getRecordsProcessed() > 0 && !state.isCompleted(phase);
    }

    private static void recordFailure(CheckpointManager checkpoint, Throwable failure) {
        try {
            checkpoint.recordError(failure);
        } catch (CheckpointPersistException persistFailure) {
            failure.addSuppressed(persistFailure);
        }
    }
}
