package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HouseVoteListItem(
        Integer congress,
        Integer sessionNumber,
        Integer rollCallNumber,
        String startDate,
        String result,
        String voteType,
        String legislationType,
        String legislationNumber,
        String updateDate
) {
}
