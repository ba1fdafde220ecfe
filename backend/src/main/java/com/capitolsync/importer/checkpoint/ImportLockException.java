package com.capitolsync.importer.checkpoint;

/**
 * Thrown when another import run holds the checkpoint lock.
 */
public class ImportLockException extends RuntimeException {

    public ImportLockException(String message) {
        super(message);
    }

    public ImportLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
