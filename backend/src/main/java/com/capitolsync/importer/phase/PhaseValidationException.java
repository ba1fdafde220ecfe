package com.capitolsync.importer.phase;

/**
 * Thrown when a phase finished its iteration but the result fails a completeness check
 * (too few records, or validation errors). Data written so far stays committed.
 */
public class PhaseValidationException extends RuntimeException {

    public PhaseValidationException(String message) {
        super(message);
    }
}
