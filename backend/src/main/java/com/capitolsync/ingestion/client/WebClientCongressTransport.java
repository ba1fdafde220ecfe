package com.capitolsync.ingestion.client;

import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;

/**
 * Congress.gov transport using WebClient; each call blocks until the body arrives or the timeout elapses.
 */
public class WebClientCongressTransport implements CongressApiTransport {

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientCongressTransport(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String get(URI uri) {
        String body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class, e -> new CongressApiException(
                        "HTTP " + e.getStatusCode().value() + " from " + uri.getPath(),
                        e.getStatusCode().value(), retryAfterMs(e.getHeaders()), e))
                .onErrorMap(e -> !(e instanceof CongressApiException),
                        e -> CongressApiException.network("Request to " + uri.getPath() + " failed: " + e.getMessage(), e))
                .block();
        if (body == null) {
            throw new CongressApiException("Empty response body from " + uri.getPath());
        }
        return body;
    }

    static long retryAfterMs(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()) * 1000L);
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by Congress.gov; fall back to the retry policy delay
            return 0L;
        }
    }
}
