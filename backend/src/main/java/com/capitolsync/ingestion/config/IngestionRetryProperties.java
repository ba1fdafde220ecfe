package com.capitolsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream API retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "capitolsync.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Upper bound for a single backoff delay in ms. Default 30000. */
    private long maxDelayMs = 30_000L;

    /** Jitter factor 0..1 (e.g. 0.3 = ±30%). Default 0.3. */
    private double jitterFactor = 0.3;

    /** Max retry attempts (excluding initial call). Default 3. */
    private int maxAttempts = 3;
}
