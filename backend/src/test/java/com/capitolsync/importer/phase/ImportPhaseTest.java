package com.capitolsync.importer.phase;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.capitolsync.importer.phase.ImportPhase.BILLS;
import static com.capitolsync.importer.phase.ImportPhase.COMMITTEES;
import static com.capitolsync.importer.phase.ImportPhase.LEGISLATORS;
import static com.capitolsync.importer.phase.ImportPhase.VALIDATE;
import static com.capitolsync.importer.phase.ImportPhase.VOTES;
import static org.assertj.core.api.Assertions.assertThat;

class ImportPhaseTest {

    @Test
    @DisplayName("with legislators and committees done, bills is next, never votes or validate")
    void nextEligibleFollowsDeclaredOrder() {
        assertThat(ImportPhase.nextEligible(List.of(LEGISLATORS, COMMITTEES))).contains(BILLS);
    }

    @Test
    void nextEligibleEmptyWhenAllCompleted() {
        assertThat(ImportPhase.nextEligible(List.of(ImportPhase.values()))).isEmpty();
        assertThat(ImportPhase.nextEligible(List.of())).contains(LEGISLATORS);
    }

    @Test
    void votesDependsOnLegislatorsAndBillsOnly() {
        assertThat(VOTES.missingDependencies(Set.of(LEGISLATORS))).containsExactly(BILLS);
        assertThat(VOTES.isEligible(Set.of(LEGISLATORS, BILLS))).isTrue();
        assertThat(VALIDATE.missingDependencies(Set.of(LEGISLATORS, BILLS)))
                .containsExactly(COMMITTEES, VOTES);
    }

    @Test
    void dependenciesOnlyReferToEarlierPhases() {
        for (ImportPhase phase : ImportPhase.values()) {
            assertThat(phase.dependencies()).allMatch(dep -> dep.ordinal() < phase.ordinal());
        }
    }

    @Test
    void fromTagIsCaseInsensitive() {
        assertThat(ImportPhase.fromTag("Bills")).contains(BILLS);
        assertThat(ImportPhase.fromTag("sponsors")).isEmpty();
        assertThat(ImportPhase.fromTag(null)).isEmpty();
    }
}
