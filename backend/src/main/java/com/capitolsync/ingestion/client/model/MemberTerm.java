package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemberTerm(
        String chamber,
        Integer congress,
        Integer startYear,
        Integer endYear,
        String memberType,
        String stateCode,
        String stateName,
        Integer district
) {
}
