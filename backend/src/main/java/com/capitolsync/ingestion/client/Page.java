package com.capitolsync.ingestion.client;

import java.util.List;

/**
 * One fetched page of a list resource.
 */
public record Page<T>(List<T> items, boolean hasNext) {

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), false);
    }
}
