package com.capitolsync.importer.run;

import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;

import java.util.List;
import java.util.Optional;

/**
 * Parsed importer arguments.
 */
public record ImportCommandLine(boolean help, boolean dryRun, boolean resume, boolean status, boolean reset,
                                boolean force, boolean verbose, ImportPhase phase) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: capitolsync-import [options]",
            "",
            "Options:",
            "  -h, --help          Show this help",
            "  -d, --dry-run       Fetch and transform without writing (at most 100 records per phase)",
            "  -r, --resume        Resume from the last checkpoint (default)",
            "  -s, --status        Print the checkpoint status and exit",
            "      --reset         Delete the checkpoint and exit",
            "  -f, --force         Reset the checkpoint and start over",
            "  -v, --verbose       Log every batch",
            "  -p, --phase <tag>   Run a single phase: " + ImportPhase.tags(),
            "",
            "Phases run in order: legislators, committees, bills, votes, validate.",
            "Interrupted runs resume where they stopped when started again.");

    /**
     * @throws UsageException on an unknown flag, a missing phase value or an unknown phase tag
     */
    public static ImportCommandLine parse(List<String> args) {
        boolean help = false;
        boolean dryRun = false;
        boolean status = false;
        boolean reset = false;
        boolean force = false;
        boolean verbose = false;
        ImportPhase phase = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-h", "--help" -> help = true;
                case "-d", "--dry-run" -> dryRun = true;
                case "-r", "--resume" -> {
                    // resuming is the default
                }
                case "-s", "--status" -> status = true;
                case "--reset" -> reset = true;
                case "-f", "--force" -> force = true;
                case "-v", "--verbose" -> verbose = true;
                case "-p", "--phase" -> {
                    if (i + 1 >= args.size() || args.get(i + 1).startsWith("-")) {
                        throw new UsageException("Missing value for " + arg);
                    }
                    String tag = args.get(++i);
                    phase = resolvePhase(tag);
                }
                default -> {
                    if (arg.startsWith("--phase=")) {
                        phase = resolvePhase(arg.substring("--phase=".length()));
                    } else {
                        throw new UsageException("Unknown option: " + arg);
                    }
                }
            }
        }
        return new ImportCommandLine(help, dryRun, true, status, reset, force, verbose, phase);
    }

    public Optional<ImportPhase> singlePhase() {
        return Optional.ofNullable(phase);
    }

    public ImportOptions toOptions() {
        return new ImportOptions(dryRun, verbose, force, resume);
    }

    private static ImportPhase resolvePhase(String tag) {
        return ImportPhase.fromTag(tag).orElseThrow(() ->
                new UsageException("Unknown phase '" + tag + "'. Valid phases: " + ImportPhase.tags()));
    }

    /** Invalid command line; reported with the usage text. */
    public static class UsageException extends RuntimeException {

        public UsageException(String message) {
            super(message);
        }
    }
}
