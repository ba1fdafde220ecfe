package com.capitolsync.ingestion.transform;

/**
 * Thrown when an upstream record cannot be mapped to a domain record.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
