package io.collector.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Issues GET requests against a remote JSON API. Implementations own all retry and wait behaviour;
 * callers see either a decoded body or a {@link FetchException} once retrying has been given up.
 */
public interface Fetcher {
    JsonNode fetch(String endpoint, Map<String, String> query) throws FetchException, InterruptedException;
}
