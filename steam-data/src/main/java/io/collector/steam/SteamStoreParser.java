package io.collector.steam;

import com.fasterxml.jackson.databind.JsonNode;
import io.collector.core.Record;
import io.collector.core.RecordParser;
import io.collector.fetch.Fetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Steam Store {@code appdetails}: the response is keyed by app id and flags unknown or delisted apps with
 * {@code success: false}, which yields a placeholder holding only name and steam_appid.
 */
public class SteamStoreParser implements RecordParser {
    private static final Logger log = LoggerFactory.getLogger(SteamStoreParser.class);

    private final Fetcher fetcher;
    private final String endpoint;

    public SteamStoreParser(Fetcher fetcher, String endpoint) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
    }

    @Override
    public Record parse(String id, String name) throws Exception {
        JsonNode json = fetcher.fetch(endpoint, Map.of("appids", id));
        JsonNode app = json.path(id);
        JsonNode data = app.path("data");
        if (app.path("success").asBoolean(false) && data.isObject()) {
            return JsonRecords.fromObject(data);
        }
        log.debug("No store details for {} ({})", id, name);
        return Record.empty().put("name", name).put("steam_appid", id);
    }
}
