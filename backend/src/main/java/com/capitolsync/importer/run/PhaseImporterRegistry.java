package com.capitolsync.importer.run;

import com.capitolsync.importer.phase.ImportPhase;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Phase importers keyed by phase. Every phase must have exactly one importer; checked at startup.
 */
@Component
public class PhaseImporterRegistry {

    private final Map<ImportPhase, PhaseImporter> importers;

    public PhaseImporterRegistry(List<PhaseImporter> importers) {
        Map<ImportPhase, PhaseImporter> byPhase = new EnumMap<>(ImportPhase.class);
        for (PhaseImporter importer : importers) {
            PhaseImporter previous = byPhase.put(importer.phase(), importer);
            if (previous != null) {
                throw new IllegalStateException("Two importers for phase '" + importer.phase().tag() + "': "
                        + previous.getClass().getSimpleName() + ", " + importer.getClass().getSimpleName());
            }
        }
        for (ImportPhase phase : ImportPhase.values()) {
            if (!byPhase.containsKey(phase)) {
                throw new IllegalStateException("No importer registered for phase '" + phase.tag() + "'");
            }
        }
        this.importers = Collections.unmodifiableMap(byPhase);
    }

    public PhaseImporter get(ImportPhase phase) {
        return importers.get(phase);
    }
}
