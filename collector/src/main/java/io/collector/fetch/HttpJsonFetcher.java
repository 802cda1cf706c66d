package io.collector.fetch;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.collector.core.Sleeper;
import io.collector.metrics.Metrics;
import io.collector.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Blocking JSON GET client. Every failure is classified and handed to the retry policy; the loop only
 * ends with a decoded body or with the policy refusing another attempt.
 */
public class HttpJsonFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpJsonFetcher.class);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration timeout;
    private final String userAgent;

    private final Timer requestTimer;
    private final Counter retries;
    private final Map<FetchException.Kind, Counter> failures = new EnumMap<>(FetchException.Kind.class);

    public HttpJsonFetcher(HttpClient http, ObjectMapper mapper, RetryPolicy retryPolicy, Sleeper sleeper,
                           Metrics metrics, Duration timeout, String userAgent) {
        this.http = Objects.requireNonNull(http);
        this.mapper = Objects.requireNonNull(mapper);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.userAgent = userAgent == null ? "Mozilla/5.0" : userAgent;
        this.requestTimer = metrics.timer("fetch.time");
        this.retries = metrics.counter("fetch.retries");
        for (FetchException.Kind k : FetchException.Kind.values()) {
            failures.put(k, metrics.counter("fetch.failures." + k.name().toLowerCase()));
        }
    }

    @Override
    public JsonNode fetch(String endpoint, Map<String, String> query) throws FetchException, InterruptedException {
        URI uri = buildUri(endpoint, query);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            FetchException failure;
            try (Timer.Context ignored = requestTimer.time()) {
                return attemptOnce(req);
            } catch (FetchException e) {
                failure = e;
            }
            failures.get(failure.kind()).inc();
            if (!retryPolicy.shouldRetry(attempt, failure)) {
                throw new FetchException(failure.kind(),
                        "giving up on " + uri + " after " + attempt + " attempt(s): " + failure.getMessage(),
                        failure.getCause(), attempt);
            }
            retries.inc();
            long waitMillis = retryPolicy.backoffMillis(attempt, failure);
            switch (failure.kind()) {
                case TRANSPORT -> log.warn("Transport error on {}: {}", uri, failure.getMessage());
                case NO_RESPONSE -> log.warn("No response from {} ({}), waiting {} ms", uri, failure.getMessage(), waitMillis);
                case MALFORMED -> log.warn("Invalid JSON from {}: {}", uri, failure.getMessage());
            }
            countdown(waitMillis);
            log.info("Retrying {} (attempt {})", uri, attempt + 1);
        }
    }

    private JsonNode attemptOnce(HttpRequest req) throws FetchException, InterruptedException {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.TRANSPORT, e.toString(), e);
        }
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(FetchException.Kind.NO_RESPONSE, "HTTP " + status, null);
        }
        String body = resp.body();
        if (body == null || body.isBlank()) {
            throw new FetchException(FetchException.Kind.NO_RESPONSE, "empty body", null);
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(FetchException.Kind.MALFORMED, e.getOriginalMessage(), e);
        }
    }

    // Whole seconds are slept one at a time so the operator sees the wait tick down.
    private void countdown(long millis) throws InterruptedException {
        long remaining = millis;
        while (remaining >= 1000) {
            log.info("Waiting... ({})", (remaining + 999) / 1000);
            sleeper.sleep(Duration.ofSeconds(1));
            remaining -= 1000;
        }
        if (remaining > 0) sleeper.sleep(Duration.ofMillis(remaining));
    }

    static URI buildUri(String endpoint, Map<String, String> query) {
        if (query == null || query.isEmpty()) return URI.create(endpoint);
        StringJoiner qs = new StringJoiner("&");
        query.forEach((k, v) -> qs.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8)));
        return URI.create(endpoint + (endpoint.contains("?") ? "&" : "?") + qs);
    }
}
