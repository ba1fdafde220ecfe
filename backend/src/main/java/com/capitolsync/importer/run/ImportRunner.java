package com.capitolsync.importer.run;

import com.capitolsync.importer.checkpoint.CheckpointLock;
import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointState;
import com.capitolsync.importer.checkpoint.ImportLockException;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point of the bulk import. Exit code 0 on success, 1 on any failure.
 */
@Component
@ConditionalOnProperty(prefix = "capitolsync.importer.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ImportRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CheckpointManager checkpoint;
    private final ImportOrchestrator orchestrator;
    private final EnvironmentValidator environmentValidator;
    private final ImporterProperties properties;
    private final StatusReporter reporter;
    private final Runnable onSignalExit;

    private int exitCode;

    @Autowired
    public ImportRunner(CheckpointManager checkpoint, ImportOrchestrator orchestrator,
                        EnvironmentValidator environmentValidator, ImporterProperties properties) {
        this(checkpoint, orchestrator, environmentValidator, properties, new StatusReporter(System.out),
                () -> Runtime.getRuntime().halt(0));
    }

    ImportRunner(CheckpointManager checkpoint, ImportOrchestrator orchestrator,
                 EnvironmentValidator environmentValidator, ImporterProperties properties,
                 StatusReporter reporter, Runnable onSignalExit) {
        this.checkpoint = checkpoint;
        this.orchestrator = orchestrator;
        this.environmentValidator = environmentValidator;
        this.properties = properties;
        this.reporter = reporter;
        this.onSignalExit = onSignalExit;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(List.of(args.getSourceArgs()));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> args) {
        ImportCommandLine commandLine;
        try {
            commandLine = ImportCommandLine.parse(args);
        } catch (ImportCommandLine.UsageException e) {
            reporter.printUsage(e.getMessage());
            return 1;
        }
        if (commandLine.help()) {
            reporter.printUsage(null);
            return 0;
        }
        if (commandLine.status()) {
            checkpoint.load();
            reporter.printStatus(checkpoint);
            return 0;
        }
        List<String> problems = environmentValidator.validate();
        if (!commandLine.reset() && !problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment: {}", problem));
            return 1;
        }
        try (CheckpointLock ignored = CheckpointLock.acquire(lockFile())) {
            if (commandLine.reset()) {
                checkpoint.reset();
                reporter.println("Checkpoint cleared.");
                return 0;
            }
            return runImport(commandLine);
        } catch (ImportLockException e) {
            log.error("{}", e.getMessage());
            return 1;
        }
    }

    private int runImport(ImportCommandLine commandLine) {
        ImportOptions options = commandLine.toOptions();
        CheckpointManager manager = options.dryRun() ? checkpoint.detachedCopy() : checkpoint;
        if (options.dryRun()) {
            log.info("DRY RUN: no records or checkpoints are written; at most {} records per phase",
                    properties.getDryRunMaxRecords());
        }
        if (options.force()) {
            log.info("Force: discarding the existing checkpoint");
            manager.reset();
        }
        Optional<CheckpointState> existing = manager.load();
        if (existing.isPresent()) {
            CheckpointState state = existing.get();
            log.info("Resuming import {} at phase '{}' ({} records processed, completed: {})", state.getRunId(),
                    state.getPhase().tag(), state.getRecordsProcessed(), state.getCompletedPhases());
        } else {
            CheckpointState created = manager.create();
            log.info("Starting new import {}", created.getRunId());
        }
        if (options.verbose()) {
            logConfiguration();
        }

        int code;
        try (RunContext context = RunContext.open(manager, onSignalExit)) {
            Optional<ImportPhase> single = commandLine.singlePhase();
            if (single.isPresent()) {
                orchestrator.executePhase(single.get(), options, context);
            } else {
                orchestrator.executeAll(options, context);
            }
            if (manager.isComplete()) {
                log.info("Import complete");
            }
            code = 0;
        } catch (ImportCancelledException e) {
            log.warn("{}", e.getMessage());
            code = 0;
        } catch (RuntimeException | Error e) {
            log.error("Import failed: {}", e.toString(), e);
            log.error("Fix the problem and run the importer again to resume");
            code = 1;
        }
        reporter.printStatus(manager);
        return code;
    }

    private Path lockFile() {
        ImporterProperties.Checkpoint settings = properties.getCheckpoint();
        return Path.of(settings.getDirectory()).resolve(settings.getLockFileName());
    }

    private void logConfiguration() {
        log.info("Congresses: {} | bill types: {} | vote sessions: {}",
                properties.getCongresses(), properties.getBillTypes(), properties.getVoteSessions());
        for (ImportPhase phase : ImportPhase.values()) {
            if (phase == ImportPhase.VALIDATE) {
                continue;
            }
            ImporterProperties.PhaseSettings settings = properties.settingsFor(phase);
            log.info("  {}: batch {}, page {}, expected ~{}", phase.tag(), settings.getBatchSize(),
                    settings.getPageSize(), settings.getEstimatedTotal());
        }
        log.info("Checkpoint: {}", checkpoint.describeStore());
    }
}
