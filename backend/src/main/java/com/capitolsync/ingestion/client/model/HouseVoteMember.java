package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HouseVoteMember(
        String bioguideId,
        String fullName,
        String party,
        String state,
        String votePosition,
        Boolean isProxy,
        String pairedWith
) {
}
