package com.capitolsync.ingestion.config;

import com.capitolsync.common.RetryPolicy;
import com.capitolsync.ingestion.client.CongressApiTransport;
import com.capitolsync.ingestion.client.WebClientCongressTransport;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Congress.gov client: one shared rate limiter, the retry policy and the WebClient transport.
 */
@Configuration
@EnableConfigurationProperties({ CongressApiProperties.class, IngestionRetryProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy congressApiRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    /** All Congress.gov requests of the process draw from this single budget. */
    @Bean(name = "congressApiRateLimiter")
    public RateLimiter congressApiRateLimiter(CongressApiProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(properties.getWindowMs()))
                .limitForPeriod(Math.max(1, properties.getRequestsPerWindow()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getAcquireTimeoutMs())))
                .build();
        return RateLimiter.of("congress-api", config);
    }

    @Bean
    public CongressApiTransport congressApiTransport(WebClient.Builder webClientBuilder, CongressApiProperties properties) {
        return new WebClientCongressTransport(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }
}
