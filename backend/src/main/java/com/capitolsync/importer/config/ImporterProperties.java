package com.capitolsync.importer.config;

import com.capitolsync.importer.phase.ImportPhase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk import scope, batch sizes, thresholds and checkpoint location. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "capitolsync.importer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ImporterProperties {

    /** Congresses imported by the bills and votes phases, in iteration order. */
    @NotEmpty
    private List<Integer> congresses = new ArrayList<>(List.of(118, 119));

    /** Bill types imported per congress, in iteration order. */
    @NotEmpty
    private List<String> billTypes = new ArrayList<>(List.of("hr", "s", "hjres", "sjres", "hconres", "sconres", "hres", "sres"));

    /** House sessions imported per congress by the votes phase. */
    @NotEmpty
    private List<Integer> voteSessions = new ArrayList<>(List.of(1, 2));

    /** Records processed per phase in a dry run before stopping. Default 100. */
    @Min(1)
    private long dryRunMaxRecords = 100;

    /** Log a progress line every N processed records. Default 100. */
    @Min(1)
    private long progressLogInterval = 100;

    @Valid
    private Checkpoint checkpoint = new Checkpoint();

    @Valid
    private Cli cli = new Cli();

    @Valid
    private PhaseSettings legislators = new PhaseSettings(50, 100, 550, 535, 0.0);

    @Valid
    private PhaseSettings committees = new PhaseSettings(25, 50, 280, 200, 0.0);

    @Valid
    private PhaseSettings bills = new PhaseSettings(50, 100, 20_000, 0, 0.8);

    @Valid
    private PhaseSettings votes = new PhaseSettings(25, 50, 1_800, 0, 0.5);

    /** Expected bill count per congress, used by progress display and validation. */
    private Map<Integer, Long> estimatedBillsByCongress = new LinkedHashMap<>(Map.of(118, 15_000L, 119, 5_000L));

    /** Expected House roll calls per congress, used by progress display and validation. */
    private Map<Integer, Long> estimatedVotesByCongress = new LinkedHashMap<>(Map.of(118, 1_500L, 119, 300L));

    /** Share of an estimate a count must reach before validation reports it. Default 0.8. */
    private double validationRatio = 0.8;

    /** Share of the vote estimate a per-congress vote count must reach. Default 0.5. */
    private double voteValidationRatio = 0.5;

    /** Settings for one phase; the validate phase has none. */
    public PhaseSettings settingsFor(ImportPhase phase) {
        return switch (phase) {
            case LEGISLATORS -> legislators;
            case COMMITTEES -> committees;
            case BILLS -> bills;
            case VOTES -> votes;
            case VALIDATE -> throw new IllegalArgumentException("validate has no batch settings");
        };
    }

    public long estimatedBills(int congress) {
        return estimatedBillsByCongress.getOrDefault(congress, 0L);
    }

    public long estimatedVotes(int congress) {
        return estimatedVotesByCongress.getOrDefault(congress, 0L);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Checkpoint {

        /** Directory holding the checkpoint files and the run lock. */
        private String directory = ".import-checkpoints";

        private String fileName = "import-checkpoint.json";

        /** Previous checkpoint, kept as a fallback when the main file is corrupt. */
        private String backupFileName = "import-checkpoint.backup.json";

        private String lockFileName = "import.lock";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Cli {

        /** Run the importer on startup. Disabled in integration tests. */
        private boolean enabled = true;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class PhaseSettings {

        /** Records upserted between checkpoint writes. */
        @Min(1)
        private int batchSize;

        /** Records requested per upstream page. */
        @Min(1)
        private int pageSize;

        /** Expected total, progress display only. */
        private long estimatedTotal;

        /** Phase fails when fewer records were processed (0 disables). */
        private long minRecords;

        /** Phase warns when fewer than this share of the estimate was processed (0 disables). */
        private double warnRatio;

        public PhaseSettings(int batchSize, int pageSize, long estimatedTotal, long minRecords, double warnRatio) {
            this.batchSize = batchSize;
            this.pageSize = pageSize;
            this.estimatedTotal = estimatedTotal;
            this.minRecords = minRecords;
            this.warnRatio = warnRatio;
        }
    }
}
