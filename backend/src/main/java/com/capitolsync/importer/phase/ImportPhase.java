package com.capitolsync.importer.phase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Import phases in declared order. The declared order is the tie-break used to pick the next eligible phase;
 * dependencies form a DAG over earlier phases only.
 */
public enum ImportPhase {

    LEGISLATORS("legislators", "Import current and historical members of Congress"),
    COMMITTEES("committees", "Import committees and subcommittees", LEGISLATORS),
    BILLS("bills", "Import bills for each target congress and bill type", LEGISLATORS, COMMITTEES),
    VOTES("votes", "Import House roll call votes and member positions", LEGISLATORS, BILLS),
    VALIDATE("validate", "Check record counts and referential integrity", LEGISLATORS, COMMITTEES, BILLS, VOTES);

    private final String tag;
    private final String description;
    private final List<ImportPhase> dependencies;

    ImportPhase(String tag, String description, ImportPhase... dependencies) {
        this.tag = tag;
        this.description = description;
        this.dependencies = List.of(dependencies);
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String description() {
        return description;
    }

    public List<ImportPhase> dependencies() {
        return dependencies;
    }

    /** Dependencies of this phase not contained in {@code completed}, in declared order. */
    public List<ImportPhase> missingDependencies(Collection<ImportPhase> completed) {
        return dependencies.stream().filter(d -> !completed.contains(d)).toList();
    }

    public boolean isEligible(Collection<ImportPhase> completed) {
        return !completed.contains(this) && missingDependencies(completed).isEmpty();
    }

    public static ImportPhase first() {
        return values()[0];
    }

    /**
     * First phase in declared order that is not completed and whose dependencies are all completed.
     */
    public static Optional<ImportPhase> nextEligible(Collection<ImportPhase> completed) {
        return Arrays.stream(values()).filter(p -> p.isEligible(completed)).findFirst();
    }

    public static Optional<ImportPhase> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(p -> p.tag.equalsIgnoreCase(tag.trim())).findFirst();
    }

    @JsonCreator
    public static ImportPhase fromJson(String tag) {
        return fromTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + tag));
    }

    public static String tags() {
        return Arrays.stream(values()).map(ImportPhase::tag).collect(Collectors.joining(", "));
    }
}
