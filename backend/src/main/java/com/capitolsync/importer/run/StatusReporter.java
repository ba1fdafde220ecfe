package com.capitolsync.importer.run;

import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.PhaseSummary;
import com.capitolsync.importer.checkpoint.ProgressSummary;
import com.capitolsync.importer.phase.ImportPhase;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Human-readable checkpoint status written to the console, separate from the log.
 */
public class StatusReporter {

    private final PrintStream out;

    public StatusReporter(PrintStream out) {
        this.out = out;
    }

    public void printStatus(CheckpointManager checkpoint) {
        Optional<CheckpointState> loaded = checkpoint.getState();
        Optional<ProgressSummary> progress = checkpoint.getProgressSummary();
        out.println();
        out.println("=== Import status ===");
        if (loaded.isEmpty() || progress.isEmpty()) {
            out.println("No checkpoint found at " + checkpoint.describeStore() + ". The next run starts fresh.");
            return;
        }
        CheckpointState state = loaded.get();
        ProgressSummary summary = progress.get();
        out.println("Run:        " + summary.runId());
        out.println("Elapsed:    " + summary.elapsedText());
        out.println("Phases:     " + summary.completedCount() + "/" + summary.totalPhases() + " completed");
        for (ImportPhase phase : ImportPhase.values()) {
            out.println("  " + marker(state, phase) + " " + phase.tag() + summaryText(state.getSummary(phase)));
        }
        if (!state.isCompleted(state.getPhase())) {
            out.println("Current:    " + state.getPhase().tag() + " " + summary.progressPercent() + "% ("
                    + state.getRecordsProcessed() + "/" + state.getTotalExpected() + ")" + position(state));
        }
        checkpoint.getNextPhase().ifPresentOrElse(
                next -> out.println("Next phase: " + next.tag()),
                () -> out.println("All phases completed"));
        if (state.getLastError() != null) {
            out.println("Last error: " + state.getLastError());
        }
    }

    public void printUsage(String message) {
        if (message != null) {
            out.println("Error: " + message);
            out.println();
        }
        out.println(ImportCommandLine.USAGE);
    }

    public void println(String line) {
        out.println(line);
    }

    private static String marker(CheckpointState state, ImportPhase phase) {
        if (state.isCompleted(phase)) {
            return "[x]";
        }
        return phase == state.getPhase() ? "[>]" : "[ ]";
    }

    private static String summaryText(PhaseSummary summary) {
        if (summary == null) {
            return "";
        }
        return "  (created " + summary.created() + ", updated " + summary.updated() + ", skipped "
                + summary.skipped() + ", errors " + summary.errorCount() + ")";
    }

    private static String position(CheckpointState state) {
        StringBuilder sb = new StringBuilder();
        if (state.getCongress() != null) {
            sb.append(" at C").append(state.getCongress());
            if (state.getBillType() != null) {
                sb.append('/').append(state.getBillType());
            }
            if (state.getSession() != null) {
                sb.append("/session ").append(state.getSession());
            }
        }
        if (state.getOffset() > 0) {
            sb.append(" offset ").append(state.getOffset());
        }
        return sb.toString();
    }
}
