package com.capitolsync.importer.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Checkpoint as a JSON file. Writes go to a temp file, the previous file is copied to the backup and the temp
 * file is then moved over the main file, so a crash mid-write leaves either the old or the new state.
 * A main file that is missing, cannot be parsed or fails validation falls back to the backup.
 */
@Slf4j
public class JsonFileCheckpointStore implements CheckpointStore {

    private final ObjectMapper objectMapper;
    private final Path mainFile;
    private final Path backupFile;
    private final Path tempFile;

    public JsonFileCheckpointStore(ObjectMapper objectMapper, Path directory, String fileName, String backupFileName) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mainFile = directory.resolve(fileName);
        this.backupFile = directory.resolve(backupFileName);
        this.tempFile = directory.resolve(fileName + ".tmp");
    }

    @Override
    public Optional<CheckpointState> load() {
        if (Files.exists(mainFile)) {
            Optional<CheckpointState> main = read(mainFile);
            if (main.isPresent()) {
                return main;
            }
            log.warn("Checkpoint {} is unreadable, trying backup {}", mainFile, backupFile);
        } else if (Files.exists(backupFile)) {
            log.warn("Checkpoint {} is missing, trying backup {}", mainFile, backupFile);
        } else {
            return Optional.empty();
        }
        Optional<CheckpointState> backup = Files.exists(backupFile) ? read(backupFile) : Optional.empty();
        if (backup.isPresent()) {
            log.warn("Restored checkpoint from backup (run {})", backup.get().getRunId());
        } else {
            log.warn("No usable checkpoint backup; starting without checkpoint");
        }
        return backup;
    }

    @Override
    public void save(CheckpointState state) {
        try {
            Files.createDirectories(mainFile.getParent());
            Files.writeString(tempFile, objectMapper.writeValueAsString(state));
            if (Files.exists(mainFile)) {
                Files.copy(mainFile, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
            moveIntoPlace();
        } catch (IOException e) {
            throw new CheckpointPersistException("Failed to write checkpoint " + mainFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete() {
        try {
            Files.deleteIfExists(mainFile);
            Files.deleteIfExists(backupFile);
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            throw new CheckpointPersistException("Failed to delete checkpoint " + mainFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return mainFile.toString();
    }

    Path mainFile() {
        return mainFile;
    }

    Path backupFile() {
        return backupFile;
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(tempFile, mainFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing non-atomically", mainFile);
            Files.move(tempFile, mainFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Optional<CheckpointState> read(Path file) {
        try {
            CheckpointState state = objectMapper.readValue(Files.readString(file), CheckpointState.class);
            String problem = validate(state);
            if (problem != null) {
                log.warn("Checkpoint {} failed validation: {}", file, problem);
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Checkpoint {} is not valid JSON: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Checkpoint {} could not be read: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Null when valid, otherwise the first problem found. */
    static String validate(CheckpointState state) {
        if (state == null) {
            return "empty document";
        }
        if (state.getRunId() == null || state.getRunId().isBlank()) {
            return "missing runId";
        }
        if (state.getPhase() == null) {
            return "missing phase";
        }
        if (state.getCompletedPhases() == null || state.getCompletedPhases().contains(null)) {
            return "invalid completedPhases";
        }
        if (state.getCompletedPhases().stream().distinct().count() != state.getCompletedPhases().size()) {
            return "duplicate completedPhases";
        }
        if (state.getOffset() < 0 || state.getRecordsProcessed() < 0 || state.getTotalExpected() < 0) {
            return "negative counter";
        }
        if (state.getPhaseSummaries() == null) {
            return "missing phaseSummaries";
        }
        return null;
    }
}
