package com.capitolsync.importer.checkpoint;

import com.capitolsync.importer.phase.ImportPhase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileCheckpointStoreTest {

    @TempDir
    Path dir;

    private JsonFileCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileCheckpointStore(new ObjectMapper().findAndRegisterModules(), dir,
                "import-checkpoint.json", "import-checkpoint.backup.json");
    }

    @Test
    void missingFileLoadsEmpty() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedStateLoadsBack() {
        CheckpointState state = state("run-1", 200);
        state.setCompletedPhases(List.of(ImportPhase.LEGISLATORS, ImportPhase.COMMITTEES));
        state.setPhase(ImportPhase.BILLS);
        state.setCongress(119);
        state.setBillType("hr");
        state.getPhaseSummaries().put("legislators", new PhaseSummary(540, 0, 2, 1, 9000));

        store.save(state);
        CheckpointState loaded = store.load().orElseThrow();

        assertThat(loaded.getRunId()).isEqualTo("run-1");
        assertThat(loaded.getPhase()).isEqualTo(ImportPhase.BILLS);
        assertThat(loaded.getCompletedPhases()).containsExactly(ImportPhase.LEGISLATORS, ImportPhase.COMMITTEES);
        assertThat(loaded.getOffset()).isEqualTo(200);
        assertThat(loaded.getCongress()).isEqualTo(119);
        assertThat(loaded.getSummary(ImportPhase.LEGISLATORS).created()).isEqualTo(540);
        assertThat(loaded.getCreatedAt()).isEqualTo(state.getCreatedAt());
    }

    @Test
    void phasesAreWrittenAsTags() throws IOException {
        store.save(state("run-1", 0));

        assertThat(Files.readString(store.mainFile())).contains("\"phase\" : \"legislators\"");
        assertThat(dir.resolve("import-checkpoint.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("a corrupt main file falls back to the previous state kept in the backup")
    void corruptMainFileFallsBackToBackup() throws IOException {
        store.save(state("run-1", 100));
        store.save(state("run-1", 200));
        Files.writeString(store.mainFile(), "{\"runId\": \"run-1\", \"offs");

        CheckpointState loaded = store.load().orElseThrow();

        assertThat(loaded.getOffset()).isEqualTo(100);
    }

    @Test
    @DisplayName("a missing main file falls back to the backup")
    void missingMainFileFallsBackToBackup() throws IOException {
        store.save(state("run-1", 100));
        store.save(state("run-1", 200));
        Files.delete(store.mainFile());

        CheckpointState loaded = store.load().orElseThrow();

        assertThat(loaded.getOffset()).isEqualTo(100);
    }

    @Test
    void invalidStateIsRejected() throws IOException {
        Files.writeString(store.mainFile(), "{\"runId\":\"run-1\",\"phase\":\"legislators\",\"offset\":-4}");

        assertThat(store.load()).isEmpty();
    }

    @Test
    void unknownPhaseTagIsRejected() throws IOException {
        Files.writeString(store.mainFile(), "{\"runId\":\"run-1\",\"phase\":\"sponsors\"}");

        assertThat(store.load()).isEmpty();
    }

    @Test
    void deleteRemovesBothFiles() {
        store.save(state("run-1", 1));
        store.save(state("run-1", 2));

        store.delete();

        assertThat(store.mainFile()).doesNotExist();
        assertThat(store.backupFile()).doesNotExist();
        assertThat(store.load()).isEmpty();
    }

    private static CheckpointState state(String runId, long offset) {
        CheckpointState state = new CheckpointState();
        state.setRunId(runId);
        state.setPhase(ImportPhase.LEGISLATORS);
        state.setOffset(offset);
        state.setRecordsProcessed(offset);
        state.setCreatedAt(Instant.parse("2026-03-01T10:00:00Z"));
        state.setUpdatedAt(Instant.parse("2026-03-01T10:05:00Z"));
        return state;
    }
}
