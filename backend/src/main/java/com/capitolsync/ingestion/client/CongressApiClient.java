package com.capitolsync.ingestion.client;

import com.capitolsync.common.RetryPolicy;
import com.capitolsync.ingestion.client.model.BillListItem;
import com.capitolsync.ingestion.client.model.BillListResponse;
import com.capitolsync.ingestion.client.model.CommitteeListItem;
import com.capitolsync.ingestion.client.model.CommitteeListResponse;
import com.capitolsync.ingestion.client.model.HouseVoteDetail;
import com.capitolsync.ingestion.client.model.HouseVoteDetailResponse;
import com.capitolsync.ingestion.client.model.HouseVoteListItem;
import com.capitolsync.ingestion.client.model.HouseVoteListResponse;
import com.capitolsync.ingestion.client.model.MemberListItem;
import com.capitolsync.ingestion.client.model.MemberListResponse;
import com.capitolsync.ingestion.client.model.Pagination;
import com.capitolsync.ingestion.config.CongressApiProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.IntFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Congress.gov v3 client. Every request takes a permit from the shared rate limiter, transient failures are
 * retried with exponential backoff and list resources are exposed as lazy ordered streams.
 * <p>
 * Ordering: list endpoints are requested without sort parameters, so the upstream default order applies and is
 * stable between calls with the same filter. Resume by offset relies on this.
 */
@Component
@Slf4j
public class CongressApiClient {

    private final CongressApiTransport transport;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final CongressApiProperties properties;

    public CongressApiClient(CongressApiTransport transport,
                             @Qualifier("congressApiRateLimiter") RateLimiter rateLimiter,
                             RetryPolicy retryPolicy,
                             ObjectMapper objectMapper,
                             CongressApiProperties properties) {
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /** Members of Congress, current or historical. */
    public Stream<MemberListItem> listMembers(boolean currentMember, int pageSize) {
        return paged(offset -> {
            Map<String, Object> params = pageParams(offset, pageSize);
            params.put("currentMember", currentMember);
            MemberListResponse response = get("/member", params, MemberListResponse.class);
            return page(nonNull(response.members()), response.members(), response.pagination());
        }, pageSize);
    }

    public Stream<CommitteeListItem> listCommittees(int pageSize) {
        return paged(offset -> {
            CommitteeListResponse response = get("/committee", pageParams(offset, pageSize), CommitteeListResponse.class);
            return page(nonNull(response.committees()), response.committees(), response.pagination());
        }, pageSize);
    }

    public Stream<BillListItem> listBills(int congress, String billType, int pageSize) {
        String path = "/bill/" + congress + "/" + billType;
        return paged(offset -> {
            BillListResponse response = get(path, pageParams(offset, pageSize), BillListResponse.class);
            return page(nonNull(response.bills()), response.bills(), response.pagination());
        }, pageSize);
    }

    /**
     * House roll calls of one session. A 404 at any offset marks the end of the data for that session.
     */
    public Stream<HouseVoteListItem> listHouseVotes(int congress, int session, int pageSize) {
        String path = "/house-vote/" + congress + "/" + session;
        return paged(offset -> {
            HouseVoteListResponse response;
            try {
                response = get(path, pageParams(offset, pageSize), HouseVoteListResponse.class);
            } catch (CongressApiException e) {
                if (e.isNotFound()) {
                    log.debug("No House votes at {} offset {}", path, offset);
                    return Page.empty();
                }
                throw e;
            }
            // the listing may mix sessions; paging continues on the unfiltered page
            List<HouseVoteListItem> votes = nonNull(response.houseRollCallVotes()).stream()
                    .filter(v -> v.sessionNumber() == null || v.sessionNumber() == session)
                    .toList();
            return page(votes, response.houseRollCallVotes(), response.pagination());
        }, pageSize);
    }

    /** Roll call detail with member positions. */
    public HouseVoteDetail getHouseVoteDetail(int congress, int session, int rollCallNumber) {
        String path = "/house-vote/" + congress + "/" + session + "/" + rollCallNumber;
        HouseVoteDetailResponse response = get(path, Map.of(), HouseVoteDetailResponse.class);
        if (response.houseRollCallVote() == null) {
            throw new CongressApiException("No roll call in response for " + path);
        }
        return response.houseRollCallVote();
    }

    /**
     * Rate-limited GET with retry, parsed into {@code type}.
     */
    <T> T get(String path, Map<String, Object> params, Class<T> type) {
        URI uri = buildUri(path, params);
        String body = getWithRetry(uri, path);
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new CongressApiException("Unreadable response from " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private String getWithRetry(URI uri, String path) {
        int maxRetries = retryPolicy.getMaxAttempts();
        for (int attempt = 0; ; attempt++) {
            acquirePermit(path);
            try {
                return transport.get(uri);
            } catch (CongressApiException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxRetries) {
                    throw new CongressApiException("Request to " + path + " failed after " + (attempt + 1) + " attempts: "
                            + e.getMessage(), e.getStatusCode(), 0L, e);
                }
                long delay = Math.max(retryPolicy.delayMs(attempt), e.getRetryAfterMs());
                log.warn("Request to {} failed ({}), retry {}/{} in {} ms", path, e.getMessage(), attempt + 1, maxRetries, delay);
                sleep(delay, path);
            }
        }
    }

    private void acquirePermit(String path) {
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new CongressApiException("Rate limiter permit not granted for " + path, e);
        }
    }

    private static void sleep(long delayMs, String path) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CongressApiException("Interrupted while backing off " + path, e);
        }
    }

    private URI buildUri(String path, Map<String, Object> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path(path)
                .queryParam("format", "json")
                .queryParam("api_key", properties.getApiKey());
        params.forEach((name, value) -> builder.queryParam(name, value));
        return builder.encode().build().toUri();
    }

    private static Map<String, Object> pageParams(int offset, int limit) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", limit);
        params.put("offset", offset);
        return params;
    }

    /** Another page follows only when the upstream announces one and the raw page was not empty. */
    private static <T> Page<T> page(List<T> items, List<?> raw, Pagination pagination) {
        boolean hasNext = raw != null && !raw.isEmpty() && pagination != null && pagination.hasNext();
        return new Page<>(items, hasNext);
    }

    private static <T> List<T> nonNull(List<T> items) {
        return items != null ? items : List.of();
    }

    private static <T> Stream<T> paged(IntFunction<Page<T>> pageFetcher, int pageSize) {
        PagedIterator<T> iterator = new PagedIterator<>(pageFetcher, pageSize);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }
}
