package org.netpreserve.fedicrawl.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.config.ApiConfig;
import org.netpreserve.fedicrawl.proxy.ProxyPool;
import org.netpreserve.fedicrawl.proxy.ProxyRecord;
import org.netpreserve.fedicrawl.proxy.ProxyUri;
import org.netpreserve.fedicrawl.ratelimit.RateLimiter;
import org.netpreserve.fedicrawl.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client for the AppView's public XRPC methods.
 * <p>
 * Every attempt first takes a slot from the rate limiter and then a proxy from the pool (going direct when the
 * pool has none). Outcomes are reported back to the pool: 5xx and network errors count against the proxy, 429 puts
 * it into cooldown, other 4xx responses don't reflect on it at all.
 */
public class ApiClient implements GraphSource {
    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);
    private final ObjectMapper mapper = new ObjectMapper();
    private final ApiConfig config;
    private final Transport transport;
    private final RateLimiter rateLimiter;
    @Nullable
    private final ProxyPool proxyPool;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final AtomicLong droppedEntities = new AtomicLong();

    public ApiClient(ApiConfig config, Transport transport, RateLimiter rateLimiter, @Nullable ProxyPool proxyPool,
                     RetryPolicy retryPolicy) {
        this(config, transport, rateLimiter, proxyPool, retryPolicy, Sleeper.SYSTEM);
    }

    public ApiClient(ApiConfig config, Transport transport, RateLimiter rateLimiter, @Nullable ProxyPool proxyPool,
                     RetryPolicy retryPolicy, Sleeper sleeper) {
        this.config = config;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.proxyPool = proxyPool;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public Profile getProfile(String actor) throws ApiException, InterruptedException {
        JsonNode body = call(Endpoint.GET_PROFILE, params("actor", actor));
        return Profile.fromJson(body);
    }

    @Override
    public EdgePage listEdges(String actor, Direction direction, @Nullable String cursor, int limit)
            throws ApiException, InterruptedException {
        var params = params("actor", actor);
        params.put("limit", String.valueOf(clampLimit(limit)));
        if (cursor != null) params.put("cursor", cursor);
        JsonNode body = call(direction.endpoint(), params);
        String field = direction == Direction.FOLLOWERS ? "followers" : "follows";
        var profiles = new ArrayList<Profile>();
        int dropped = parseProfiles(body, field, profiles);
        return new EdgePage(profiles, cursor(body), dropped);
    }

    @Override
    public SearchPage searchActors(String query, @Nullable String cursor, int limit)
            throws ApiException, InterruptedException {
        var params = params("q", query);
        params.put("limit", String.valueOf(clampLimit(limit)));
        if (cursor != null) params.put("cursor", cursor);
        JsonNode body = call(Endpoint.SEARCH_ACTORS, params);
        var profiles = new ArrayList<Profile>();
        int dropped = parseProfiles(body, "actors", profiles);
        return new SearchPage(profiles, cursor(body), dropped);
    }

    /**
     * Entities dropped so far for failing validation.
     */
    public long droppedEntities() {
        return droppedEntities.get();
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, config.pageSize()));
    }

    private int parseProfiles(JsonNode body, String field, List<Profile> into) throws ValidationException {
        JsonNode array = body.get(field);
        if (array == null || !array.isArray()) throw new ValidationException("Response has no " + field + " array");
        int dropped = 0;
        for (JsonNode item : array) {
            try {
                into.add(Profile.fromJson(item));
            } catch (ValidationException e) {
                dropped++;
                log.debug("Dropping malformed {} entry: {}", field, e.getMessage());
            }
        }
        if (dropped > 0) droppedEntities.addAndGet(dropped);
        return dropped;
    }

    @Nullable
    private static String cursor(JsonNode body) {
        JsonNode cursor = body.get("cursor");
        return cursor == null || !cursor.isTextual() || cursor.asText().isEmpty() ? null : cursor.asText();
    }

    private static Map<String, String> params(String name, String value) {
        var params = new LinkedHashMap<String, String>();
        params.put(name, value);
        return params;
    }

    private JsonNode call(Endpoint endpoint, Map<String, String> params) throws ApiException, InterruptedException {
        URI uri = buildUri(endpoint, params);
        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(endpoint, uri);
            } catch (ApiException e) {
                RetryDecision decision = retryPolicy.decide(attempt, e);
                if (!decision.shouldRetry()) throw e;
                log.atDebug().addKeyValue("endpoint", endpoint.key())
                        .addKeyValue("attempt", attempt)
                        .addKeyValue("delay", decision.delay())
                        .log("Retrying after {}", e.getMessage());
                if (!decision.delay().isZero()) sleeper.sleep(decision.delay());
            }
        }
    }

    private JsonNode attempt(Endpoint endpoint, URI uri) throws ApiException, InterruptedException {
        try (var slot = rateLimiter.acquireSlot(endpoint.key())) {
            ProxyRecord proxyRecord = proxyPool == null ? null : proxyPool.acquire();
            ProxyUri proxy = proxyRecord == null ? null : proxyRecord.uri();
            long start = System.nanoTime();
            Transport.Response response;
            try {
                response = transport.get(uri, proxy);
            } catch (IOException e) {
                if (proxy != null) proxyPool.reportFailure(proxy, e.toString());
                throw new TransientNetworkException(endpoint.key() + " failed: " + e, e);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            int status = response.status();

            if (status == 429) {
                if (proxy != null) proxyPool.reportRateLimited(proxy, response.retryAfter());
                Duration retryAfter = response.retryAfter() == null ? Duration.ZERO : response.retryAfter();
                throw new RateLimitException(endpoint.key() + " rate limited", retryAfter, proxy != null);
            } else if (status >= 500) {
                if (proxy != null) proxyPool.reportFailure(proxy, "HTTP " + status);
                throw new TransientNetworkException(endpoint.key() + " returned HTTP " + status);
            } else if (status >= 400) {
                log.atWarn().addKeyValue("endpoint", endpoint.key()).addKeyValue("status", status)
                        .log("Client error for {}", uri);
                throw new ClientErrorException(status, endpoint.key() + " returned HTTP " + status);
            } else if (status < 200 || status >= 300) {
                throw new ClientErrorException(status, endpoint.key() + " returned unexpected HTTP " + status);
            }

            if (proxy != null) proxyPool.reportSuccess(proxy, elapsed);
            try {
                JsonNode body = mapper.readTree(response.body());
                if (body == null || !body.isObject()) throw new ValidationException(endpoint.key() + " returned a non-object body");
                return body;
            } catch (JsonProcessingException e) {
                throw new ValidationException(endpoint.key() + " returned malformed JSON", e);
            }
        }
    }

    private URI buildUri(Endpoint endpoint, Map<String, String> params) {
        var sb = new StringBuilder(config.baseUrl()).append(endpoint.path());
        char separator = '?';
        for (var entry : params.entrySet()) {
            sb.append(separator)
                    .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return URI.create(sb.toString());
    }
}
