package com.capitolsync.importer.phase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a phase is started before all of its dependencies completed. Raised before any checkpoint change.
 */
public class PhaseDependencyException extends RuntimeException {

    private final ImportPhase phase;
    private final List<ImportPhase> missing;

    public PhaseDependencyException(ImportPhase phase, List<ImportPhase> missing) {
        super("Cannot run phase '" + phase.tag() + "': missing dependencies "
                + missing.stream().map(ImportPhase::tag).collect(Collectors.joining(", ")));
        this.phase = phase;
        this.missing = List.copyOf(missing);
    }

    public ImportPhase getPhase() {
        return phase;
    }

    public List<ImportPhase> getMissing() {
        return missing;
    }
}
