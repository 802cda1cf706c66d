package io.collector.steam;

import com.fasterxml.jackson.databind.JsonNode;
import io.collector.core.Record;
import io.collector.core.RecordParser;
import io.collector.fetch.Fetcher;

import java.util.LinkedHashMap;
import java.util.Map;

/** SteamSpy {@code appdetails}: the response object is already flat. */
public class SteamSpyParser implements RecordParser {
    private final Fetcher fetcher;
    private final String endpoint;

    public SteamSpyParser(Fetcher fetcher, String endpoint) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
    }

    @Override
    public Record parse(String id, String name) throws Exception {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("request", "appdetails");
        query.put("appid", id);
        JsonNode json = fetcher.fetch(endpoint, query);
        if (!json.isObject() || json.isEmpty()) {
            return Record.empty().put("appid", id).put("name", name);
        }
        return JsonRecords.fromObject(json);
    }
}
