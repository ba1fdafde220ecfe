package com.capitolsync.ingestion.store;

/**
 * Outcome of one idempotent create-or-update.
 */
public enum UpsertResult {
    CREATED,
    UPDATED;

    public boolean created() {
        return this == CREATED;
    }
}
