package com.capitolsync.importer.phase;

/**
 * Run options handed to every phase importer.
 *
 * @param dryRun  fetch and transform only; nothing is written to the store or the checkpoint file
 * @param verbose log every batch and the resolved configuration
 * @param force   the checkpoint was reset before this run
 * @param resume  continue from the persisted checkpoint (default)
 */
public record ImportOptions(boolean dryRun, boolean verbose, boolean force, boolean resume) {

    public static ImportOptions defaults() {
        return new ImportOptions(false, false, false, true);
    }
}
