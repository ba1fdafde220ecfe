package com.capitolsync.importer.config;

import com.capitolsync.importer.checkpoint.CheckpointManager;
import com.capitolsync.importer.checkpoint.CheckpointStore;
import com.capitolsync.importer.checkpoint.JsonFileCheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Checkpoint persistence for the bulk importer: one JSON file store under the configured directory.
 */
@Configuration
@EnableConfigurationProperties(ImporterProperties.class)
public class ImporterConfig {

    @Bean
    public Clock importerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectMapper objectMapper, ImporterProperties properties) {
        ImporterProperties.Checkpoint checkpoint = properties.getCheckpoint();
        return new JsonFileCheckpointStore(objectMapper, Path.of(checkpoint.getDirectory()),
                checkpoint.getFileName(), checkpoint.getBackupFileName());
    }

    @Bean
    public CheckpointManager checkpointManager(CheckpointStore checkpointStore, Clock importerClock) {
        return new CheckpointManager(checkpointStore, importerClock);
    }
}
