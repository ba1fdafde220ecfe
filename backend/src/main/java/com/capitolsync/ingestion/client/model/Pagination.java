package com.capitolsync.ingestion.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Pagination block of a list response; {@code next} is absent on the last page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pagination(Integer count, String next) {

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
