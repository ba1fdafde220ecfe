package com.capitolsync.importer.run;

/**
 * Thrown between batches once the run was asked to stop.
 */
public class ImportCancelledException extends RuntimeException {

    public ImportCancelledException(String message) {
        super(message);
    }
}
