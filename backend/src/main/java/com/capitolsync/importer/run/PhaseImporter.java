package com.capitolsync.importer.run;

import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;

/**
 * Imports one phase. Implementations read and advance the cursor through {@link RunContext#checkpoint()};
 * throwing signals phase failure.
 */
public interface PhaseImporter {

    ImportPhase phase();

    void execute(ImportOptions options, RunContext context);
}
