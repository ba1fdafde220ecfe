package com.capitolsync.importer.checkpoint;

import com.capitolsync.importer.phase.ImportPhase;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable progress of the single active import run.
 * <p>
 * {@code offset}, {@code recordsProcessed}, {@code totalExpected}, {@code congress}, {@code billType} and
 * {@code session} are local to the current phase and are reset together when a new phase is entered.
 * For cross-product phases {@code offset} is local to the current (congress, billType|session) cell.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class CheckpointState {

    private String runId;
    private ImportPhase phase;
    /** Completed phases in completion order, no duplicates. */
    private List<ImportPhase> completedPhases = new ArrayList<>();
    private long offset;
    private long recordsProcessed;
    /** Progress display only. */
    private long totalExpected;
    private Integer congress;
    private String billType;
    /** Vote session of the votes phase cursor. */
    private Integer session;
    private String lastError;
    /** Keyed by phase tag. */
    private Map<String, PhaseSummary> phaseSummaries = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isCompleted(ImportPhase p) {
        return completedPhases.contains(p);
    }

    @JsonIgnore
    public PhaseSummary getSummary(ImportPhase p) {
        return phaseSummaries.get(p.tag());
    }

    public CheckpointState copy() {
        CheckpointState copy = new CheckpointState();
        copy.runId = runId;
        copy.phase = phase;
        copy.completedPhases = new ArrayList<>(completedPhases);
        copy.offset = offset;
        copy.recordsProcessed = recordsProcessed;
        copy.totalExpected = totalExpected;
        copy.congress = congress;
        copy.billType = billType;
        copy.session = session;
        copy.lastError = lastError;
        copy.phaseSummaries = new LinkedHashMap<>(phaseSummaries);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
