package com.capitolsync.importer.run;

import com.capitolsync.importer.checkpoint.CheckpointManager;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one import run: its checkpoint manager and its cancellation flag.
 * <p>
 * {@link #open(CheckpointManager, Runnable)} installs a JVM shutdown hook for the lifetime of the run. On SIGINT or
 * SIGTERM the hook marks the run cancelled, flushes the checkpoint and then runs the exit action. {@link #close()}
 * removes the hook. In-flight requests are not interrupted, so at most one batch is redone on the next run.
 */
@Slf4j
public class RunContext implements AutoCloseable {

    private final CheckpointManager checkpoint;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Runnable onSignalExit;
    private final Thread shutdownHook;

    private RunContext(CheckpointManager checkpoint, Runnable onSignalExit) {
        this.checkpoint = checkpoint;
        this.onSignalExit = onSignalExit;
        this.shutdownHook = onSignalExit != null ? new Thread(this::onSignal, "import-shutdown") : null;
    }

    /**
     * Run context with a shutdown hook that flushes the checkpoint and then calls {@code onSignalExit}.
     */
    public static RunContext open(CheckpointManager checkpoint, Runnable onSignalExit) {
        RunContext context = new RunContext(checkpoint, onSignalExit);
        Runtime.getRuntime().addShutdownHook(context.shutdownHook);
        return context;
    }

    /** Run context without signal handling, for tests and embedded use. */
    public static RunContext detached(CheckpointManager checkpoint) {
        return new RunContext(checkpoint, null);
    }

    public CheckpointManager checkpoint() {
        return checkpoint;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @throws ImportCancelledException when the run was cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ImportCancelledException("Import interrupted; progress is saved and the next run resumes");
        }
    }

    /** Shutdown hook body: cancel, flush, then exit. The exit action runs even when the flush fails. */
    void onSignal() {
        cancel();
        log.warn("Termination signal received, saving checkpoint");
        try {
            checkpoint.flush();
            log.info("Checkpoint saved. Run the importer again to resume");
        } catch (RuntimeException e) {
            log.error("Failed to save checkpoint on shutdown: {}", e.getMessage(), e);
        }
        if (onSignalExit != null) {
            onSignalExit.run();
        }
    }

    @Override
    public void close() {
        if (shutdownHook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress; hook stays registered");
        }
    }
}
