package com.capitolsync.importer.checkpoint;

/**
 * Thrown when the checkpoint cannot be written or deleted. Always fatal for the run: without a durable
 * checkpoint a restart could not resume safely.
 */
public class CheckpointPersistException extends RuntimeException {

    public CheckpointPersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
