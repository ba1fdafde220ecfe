package com.capitolsync.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Congress.gov API access: endpoint, key and the shared request budget.
 * The default budget of 15 requests per minute keeps under the 1000/hour account limit with headroom.
 */
@ConfigurationProperties(prefix = "capitolsync.congress-api")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class CongressApiProperties {

    /** API root, without trailing slash. */
    @NotBlank
    private String baseUrl = "https://api.congress.gov/v3";

    /** API key sent as the api_key query parameter. Bound from CONGRESS_API_KEY in application.yml. */
    private String apiKey;

    /** Requests allowed per refresh window. Default 15. */
    @Min(1)
    private int requestsPerWindow = 15;

    /** Rate limiter refresh window in ms. Default 60000. */
    @Min(1)
    private long windowMs = 60_000L;

    /** Max wait for a rate limiter permit before the request fails. Default 60000. */
    private long acquireTimeoutMs = 60_000L;

    /** Per-request timeout in ms. Default 30000. */
    private long requestTimeoutMs = 30_000L;
}
