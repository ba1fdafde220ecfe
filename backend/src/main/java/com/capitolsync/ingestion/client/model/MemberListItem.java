package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Member entry of {@code GET /member}. Terms are listed most recent first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemberListItem(
        String bioguideId,
        String name,
        String partyName,
        String state,
        Integer district,
        Terms terms,
        String updateDate
) {

    public MemberTerm latestTerm() {
        if (terms == null || terms.item() == null || terms.item().isEmpty()) {
            return null;
        }
        return terms.item().get(0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Terms(List<MemberTerm> item) {
    }
}
