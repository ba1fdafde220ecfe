package com.capitolsync.importer.run;

import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointUpdate;
import com.capitolsync.importer.checkpoint.JsonFileCheckpointStore;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImportRunnerTest {

    @TempDir
    Path dir;

    @Mock private ImportOrchestrator orchestrator;
    @Mock private EnvironmentValidator environmentValidator;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private CheckpointManager checkpoint;
    private ImportRunner runner;

    @BeforeEach
    void setUp() {
        ImporterProperties properties = new ImporterProperties();
        properties.getCheckpoint().setDirectory(dir.toString());
        checkpoint = new CheckpointManager(new JsonFileCheckpointStore(new ObjectMapper().findAndRegisterModules(),
                dir, "import-checkpoint.json", "import-checkpoint.backup.json"));
        runner = new ImportRunner(checkpoint, orchestrator, environmentValidator, properties,
                new StatusReporter(new PrintStream(console, true, StandardCharsets.UTF_8)), () -> { });
        when(environmentValidator.validate()).thenReturn(List.of());
    }

    @Test
    void helpPrintsUsage() {
        assertThat(runner.execute(List.of("--help"))).isZero();

        assertThat(output()).contains("Usage:").contains("--phase <tag>");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void invalidArgumentsExitWithOne() {
        assertThat(runner.execute(List.of("--phase", "sponsors"))).isEqualTo(1);

        assertThat(output()).contains("Unknown phase 'sponsors'");
    }

    @Test
    void environmentProblemsExitWithOne() {
        when(environmentValidator.validate()).thenReturn(List.of("CONGRESS_API_KEY is not set"));

        assertThat(runner.execute(List.of())).isEqualTo(1);

        verifyNoInteractions(orchestrator);
    }

    @Test
    void runsAllPhasesOnNewCheckpoint() {
        assertThat(runner.execute(List.of())).isZero();

        verify(orchestrator).executeAll(eq(new ImportOptions(false, false, false, true)), any(RunContext.class));
        assertThat(dir.resolve("import-checkpoint.json")).exists();
        assertThat(output()).contains("=== Import status ===");
    }

    @Test
    void singlePhaseRunsOnlyThatPhase() {
        assertThat(runner.execute(List.of("-p", "committees"))).isZero();

        verify(orchestrator).executePhase(eq(ImportPhase.COMMITTEES), any(ImportOptions.class), any(RunContext.class));
        verify(orchestrator, never()).executeAll(any(), any());
    }

    @Test
    @DisplayName("a dry run never writes the checkpoint file")
    void dryRunLeavesCheckpointUntouched() {
        doAnswer(invocation -> {
            RunContext context = invocation.getArgument(1);
            context.checkpoint().update(CheckpointUpdate.builder().offset(100).build());
            return null;
        }).when(orchestrator).executeAll(any(), any());

        assertThat(runner.execute(List.of("--dry-run"))).isZero();

        assertThat(dir.resolve("import-checkpoint.json")).doesNotExist();
    }

    @Test
    void phaseFailureExitsWithOneAndPrintsStatus() {
        doThrow(new IllegalStateException("bills fetch failed")).when(orchestrator).executeAll(any(), any());

        assertThat(runner.execute(List.of())).isEqualTo(1);

        assertThat(output()).contains("=== Import status ===").contains("Next phase: legislators");
    }

    @Test
    void errorInsidePhaseExitsWithOne() {
        doThrow(new StackOverflowError("transformer recursion")).when(orchestrator).executeAll(any(), any());

        assertThat(runner.execute(List.of())).isEqualTo(1);

        assertThat(output()).contains("=== Import status ===");
    }

    @Test
    void resetDeletesCheckpoint() {
        checkpoint.create();

        assertThat(runner.execute(List.of("--reset"))).isZero();

        assertThat(dir.resolve("import-checkpoint.json")).doesNotExist();
    }

    @Test
    void statusWithoutCheckpointSaysFreshStart() {
        assertThat(runner.execute(List.of("--status"))).isZero();

        assertThat(output()).contains("No checkpoint found");
    }

    private String output() {
        return console.toString(StandardCharsets.UTF_8);
    }
}
