package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HouseVoteListResponse(List<HouseVoteListItem> houseRollCallVotes, Pagination pagination) {
}
