package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Roll call detail of {@code GET /house-vote/{congress}/{session}/{roll}}, including member positions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HouseVoteDetail(
        Integer congress,
        Integer sessionNumber,
        Integer rollCallNumber,
        String date,
        String startDate,
        String question,
        String description,
        String result,
        String voteType,
        String category,
        Integer totalYea,
        Integer totalNay,
        Integer totalPresent,
        Integer totalNotVoting,
        BillRef bill,
        List<HouseVoteMember> members
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BillRef(Integer congress, String type, String number) {
    }
}
