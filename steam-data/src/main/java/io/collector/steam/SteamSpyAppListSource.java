package io.collector.steam;

import com.fasterxml.jackson.databind.JsonNode;
import io.collector.core.Item;
import io.collector.core.ItemSource;
import io.collector.fetch.Fetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Every app SteamSpy knows about ({@code request=all}), ordered by numeric app id.
 */
public class SteamSpyAppListSource implements ItemSource {
    private static final Logger log = LoggerFactory.getLogger(SteamSpyAppListSource.class);

    static final Comparator<Item> BY_APP_ID = Comparator
            .comparingLong((Item i) -> numericId(i.id()))
            .thenComparing(Item::id);

    private final Fetcher fetcher;
    private final String endpoint;

    public SteamSpyAppListSource(Fetcher fetcher, String endpoint) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
    }

    @Override
    public List<Item> load() throws Exception {
        JsonNode json = fetcher.fetch(endpoint, Map.of("request", "all"));
        List<Item> items = new ArrayList<>(json.size());
        Iterator<Map.Entry<String, JsonNode>> it = json.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode app = e.getValue();
            String id = app.hasNonNull("appid") ? app.get("appid").asText() : e.getKey();
            items.add(new Item(id, app.path("name").asText("")));
        }
        items.sort(BY_APP_ID);
        log.info("SteamSpy listed {} apps", items.size());
        return items;
    }

    private static long numericId(String id) {
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
