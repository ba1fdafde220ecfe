package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Committee entry of {@code GET /committee}; subcommittees carry their parent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitteeListItem(
        String systemCode,
        String name,
        String chamber,
        String committeeTypeCode,
        ParentRef parent,
        String updateDate
) {

    public boolean hasParent() {
        return parent != null && parent.systemCode() != null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParentRef(String systemCode, String name) {
    }
}
