package com.capitolsync.ingestion.client;

import java.net.URI;

/**
 * Raw HTTP access to Congress.gov, separated from paging and retry for testing.
 */
public interface CongressApiTransport {

    /**
     * Perform a single GET.
     *
     * @param uri fully built request URI including the api_key parameter
     * @return response body (JSON)
     * @throws CongressApiException on HTTP error, network failure or timeout
     */
    String get(URI uri);
}
