package com.capitolsync.importer.batch;

import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.phase.PhaseValidationException;
import lombok.extern.slf4j.Slf4j;

/**
 * End-of-phase completeness check on the processed record count. Below the minimum the phase fails;
 * below the warning share of the estimate it only logs. Dry runs are never checked.
 */
@Slf4j
public final class PhaseThresholds {

    private PhaseThresholds() {
    }

    /**
     * @param expected estimate for the warning ratio; 0 disables the warning
     * @throws PhaseValidationException when {@code processed} is below the phase minimum
     */
    public static void check(ImportPhase phase, ImporterProperties.PhaseSettings settings, long processed,
                             long expected, boolean dryRun) {
        if (dryRun) {
            return;
        }
        if (settings.getMinRecords() > 0 && processed < settings.getMinRecords()) {
            throw new PhaseValidationException("Phase '" + phase.tag() + "' processed " + processed
                    + " records, expected at least " + settings.getMinRecords());
        }
        if (settings.getWarnRatio() > 0 && expected > 0 && processed < expected * settings.getWarnRatio()) {
            log.warn("Phase '{}' processed {} records, below {}% of the expected {}",
                    phase.tag(), processed, Math.round(settings.getWarnRatio() * 100), expected);
        }
    }
}
