package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bill entry of {@code GET /bill/{congress}/{type}}. Number may arrive as a string upstream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BillListItem(
        Integer congress,
        String type,
        String number,
        String originChamber,
        String originChamberCode,
        String title,
        LatestAction latestAction,
        String updateDate
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LatestAction(String actionDate, String text) {
    }
}
