package com.capitolsync.importer.batch;

import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.phase.PhaseValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhaseThresholdsTest {

    private final ImporterProperties properties = new ImporterProperties();

    @Test
    void belowMinimumFailsPhase() {
        assertThatThrownBy(() -> PhaseThresholds.check(ImportPhase.LEGISLATORS, properties.getLegislators(),
                534, 550, false))
                .isInstanceOf(PhaseValidationException.class)
                .hasMessageContaining("expected at least 535");
    }

    @Test
    void minimumReachedPasses() {
        assertThatNoException().isThrownBy(() -> PhaseThresholds.check(ImportPhase.LEGISLATORS,
                properties.getLegislators(), 535, 550, false));
    }

    @Test
    void dryRunNeverFails() {
        assertThatNoException().isThrownBy(() -> PhaseThresholds.check(ImportPhase.COMMITTEES,
                properties.getCommittees(), 100, 280, true));
    }

    @Test
    void billsBelowWarnRatioOnlyWarn() {
        assertThatNoException().isThrownBy(() -> PhaseThresholds.check(ImportPhase.BILLS,
                properties.getBills(), 10, 20_000, false));
    }
}
