package com.capitolsync.importer.phases;

import com.capitolsync.common.DurationFormat;
import com.capitolsync.domain.BillRepository;
import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.Committee;
import com.capitolsync.domain.CommitteeRepository;
import com.capitolsync.domain.Legislator;
import com.capitolsync.domain.LegislatorRepository;
import com.capitolsync.domain.Party;
import com.capitolsync.domain.RollCallVote;
import com.capitolsync.domain.RollCallVoteRepository;
import com.capitolsync.domain.VotePositionRepository;
import com.capitolsync.importer.checkpoint.PhaseSummary;
import com.capitolsync.importer.config.ImporterProperties;
import com.capitolsync.importer.phase.ImportOptions;
import com.capitolsync.importer.phase.ImportPhase;
import com.capitolsync.importer.phase.PhaseValidationException;
import com.capitolsync.importer.phases.ValidationResult.Severity;
import com.capitolsync.importer.run.PhaseImporter;
import com.capitolsync.importer.run.RunContext;
import com.capitolsync.ingestion.transform.CongressMappings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Post-import checks: record counts against estimates, referential integrity between vote positions,
 * legislators, roll calls and committee parents, and data quality spot checks.
 * <p>
 * Failed ERROR checks fail the phase outside dry runs; WARNING checks are only reported.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportValidator implements PhaseImporter {

    static final int HOUSE_MIN = 400;
    static final int HOUSE_MAX = 450;
    static final int SENATE_MIN = 95;
    static final int SENATE_MAX = 105;
    /** Share of referenced legislators that must exist. */
    static final double LEGISLATOR_INTEGRITY_RATIO = 0.95;

    private final LegislatorRepository legislators;
    private final CommitteeRepository committees;
    private final BillRepository bills;
    private final RollCallVoteRepository rollCalls;
    private final VotePositionRepository positions;
    private final ImporterProperties properties;

    @Override
    public ImportPhase phase() {
        return ImportPhase.VALIDATE;
    }

    @Override
    public void execute(ImportOptions options, RunContext context) {
        long start = System.currentTimeMillis();
        List<ValidationResult> results = runChecks();

        long passed = results.stream().filter(ValidationResult::passed).count();
        long warnings = results.stream().filter(ValidationResult::isWarning).count();
        long errors = results.stream().filter(ValidationResult::isError).count();
        for (ValidationResult result : results) {
            logResult(result, options.verbose());
        }
        long durationMs = System.currentTimeMillis() - start;
        log.info("=== Validation summary ===");
        log.info("Checks: {} | Passed: {} | Warnings: {} | Errors: {} | Duration: {}",
                results.size(), passed, warnings, errors, DurationFormat.formatMillis(durationMs));

        context.checkpoint().recordPhaseSummary(phase(), new PhaseSummary(0, 0, 0, errors, durationMs));
        if (errors > 0 && !options.dryRun()) {
            throw new PhaseValidationException("Validation failed with " + errors + " error(s)");
        }
    }

    /** All checks in reporting order. */
    List<ValidationResult> runChecks() {
        List<ValidationResult> results = new ArrayList<>();
        results.addAll(recordCounts());
        results.add(committeeHierarchy());
        results.add(voteLegislators());
        results.add(voteRollCalls());
        results.addAll(dataQuality());
        results.addAll(distribution());
        return results;
    }

    List<ValidationResult> recordCounts() {
        List<ValidationResult> results = new ArrayList<>();
        double ratio = properties.getValidationRatio();

        long legislatorMin = minimum(properties.getLegislators().getEstimatedTotal(), ratio);
        long legislatorCount = legislators.count();
        results.add(ValidationResult.of("Legislator count", legislatorCount >= legislatorMin, Severity.ERROR,
                ">= " + legislatorMin, legislatorCount, "Found " + legislatorCount + " legislators"));

        long committeeMin = minimum(properties.getCommittees().getEstimatedTotal(), ratio);
        long committeeCount = committees.count();
        results.add(ValidationResult.of("Committee count", committeeCount >= committeeMin, Severity.ERROR,
                ">= " + committeeMin, committeeCount, "Found " + committeeCount + " committees"));

        long billTotal = 0;
        long billTotalMin = 0;
        for (int congress : properties.getCongresses()) {
            long min = minimum(properties.estimatedBills(congress), ratio);
            long count = bills.countByCongress(congress);
            billTotal += count;
            billTotalMin += min;
            results.add(ValidationResult.of("Bill count (congress " + congress + ")", count >= min, Severity.ERROR,
                    ">= " + min, count, "Found " + count + " bills"));
        }
        results.add(ValidationResult.of("Total bill count", billTotal >= billTotalMin, Severity.ERROR,
                ">= " + billTotalMin, billTotal, "Found " + billTotal + " bills"));

        for (int congress : properties.getCongresses()) {
            long min = minimum(properties.estimatedVotes(congress), properties.getVoteValidationRatio());
            long count = rollCalls.countByCongress(congress);
            results.add(ValidationResult.of("Roll call count (congress " + congress + ")", count >= min,
                    Severity.WARNING, ">= " + min, count, "Found " + count + " roll calls"));
        }
        long positionCount = positions.count();
        results.add(ValidationResult.of("Vote position count", positionCount > 0, Severity.WARNING, "> 0",
                positionCount, "Found " + positionCount + " vote positions"));
        return results;
    }

    ValidationResult committeeHierarchy() {
        List<Committee> subcommittees = committees.findByParentIdIsNotNull();
        Set<String> parentIds = subcommittees.stream().map(Committee::getParentId).collect(Collectors.toSet());
        Set<String> existing = ids(committees.findAllById(parentIds), Committee::getId);
        long orphans = subcommittees.stream().filter(c -> !existing.contains(c.getParentId())).count();
        long pending = committees.findByPendingParentIdIsNotNull().size();
        long problems = orphans + pending;
        return ValidationResult.of("Committee hierarchy integrity", problems == 0, Severity.WARNING, 0, problems,
                orphans + " subcommittees with a missing parent, " + pending + " still waiting for a parent");
    }

    ValidationResult voteLegislators() {
        List<String> referenced = positions.findDistinctLegislatorIds();
        if (referenced.isEmpty()) {
            return ValidationResult.of("Vote legislator integrity", true, Severity.WARNING, "n/a", 0,
                    "No vote positions to check");
        }
        long found = ids(legislators.findAllById(referenced), Legislator::getId).size();
        double share = (double) found / referenced.size();
        return ValidationResult.of("Vote legislator integrity", share >= LEGISLATOR_INTEGRITY_RATIO, Severity.WARNING,
                ">= " + Math.round(LEGISLATOR_INTEGRITY_RATIO * 100) + "%", Math.round(share * 100) + "%",
                found + " of " + referenced.size() + " referenced legislators exist");
    }

    ValidationResult voteRollCalls() {
        List<String> referenced = positions.findDistinctRollCallIds();
        long found = ids(rollCalls.findAllById(referenced), RollCallVote::getId).size();
        long orphaned = referenced.size() - found;
        return ValidationResult.of("Vote roll call integrity", orphaned == 0, Severity.ERROR, 0, orphaned,
                orphaned + " roll calls referenced by vote positions are missing");
    }

    List<ValidationResult> dataQuality() {
        List<ValidationResult> results = new ArrayList<>();
        long untitled = bills.countByTitleIsNullOrTitle("");
        results.add(ValidationResult.of("Bills with title", untitled == 0, Severity.WARNING, 0, untitled,
                untitled + " bills without a title"));
        long undated = bills.countByIntroducedDateIsNull();
        results.add(ValidationResult.of("Bills with introduced date", undated == 0, Severity.WARNING, 0, undated,
                undated + " bills without an introduced date"));
        long unknownState = legislators.countByState(CongressMappings.UNKNOWN_STATE);
        results.add(ValidationResult.of("Legislators with state", unknownState == 0, Severity.WARNING, 0,
                unknownState, unknownState + " legislators with an unknown state"));
        long total = legislators.count();
        long synced = legislators.countByLastSyncedAtIsNotNull();
        results.add(ValidationResult.of("Sync metadata present", total == 0 || synced * 100 >= total * 95,
                Severity.WARNING, ">= 95%", synced + "/" + total, synced + " of " + total + " legislators carry a sync time"));
        return results;
    }

    List<ValidationResult> distribution() {
        List<ValidationResult> results = new ArrayList<>();
        long house = legislators.countByChamberAndInOfficeTrue(Chamber.HOUSE);
        results.add(ValidationResult.of("House member count", house >= HOUSE_MIN && house <= HOUSE_MAX,
                Severity.WARNING, HOUSE_MIN + "-" + HOUSE_MAX, house, house + " House members in office"));
        long senate = legislators.countByChamberAndInOfficeTrue(Chamber.SENATE);
        results.add(ValidationResult.of("Senate member count", senate >= SENATE_MIN && senate <= SENATE_MAX,
                Severity.WARNING, SENATE_MIN + "-" + SENATE_MAX, senate, senate + " senators in office"));
        long democrats = legislators.countByPartyAndInOfficeTrue(Party.D);
        long republicans = legislators.countByPartyAndInOfficeTrue(Party.R);
        results.add(ValidationResult.of("Party distribution", democrats > 0 && republicans > 0, Severity.WARNING,
                "D > 0 and R > 0", "D=" + democrats + ", R=" + republicans,
                democrats + " Democrats and " + republicans + " Republicans in office"));
        return results;
    }

    private static long minimum(long estimate, double ratio) {
        return (long) Math.floor(estimate * ratio);
    }

    private static <T> Set<String> ids(Iterable<T> found, Function<T, String> id) {
        return StreamSupport.stream(found.spliterator(), false).map(id).collect(Collectors.toCollection(HashSet::new));
    }

    private static void logResult(ValidationResult result, boolean verbose) {
        if (result.passed()) {
            log.info("  ok   {}: {}", result.check(), result.message());
            return;
        }
        if (result.severity() == Severity.ERROR) {
            log.error("  FAIL {}: {}", result.check(), result.message());
        } else {
            log.warn("  WARN {}: {}", result.check(), result.message());
        }
        if (verbose) {
            log.info("       expected {}, actual {}", result.expected(), result.actual());
        }
    }
}
