package io.collector.steam;

import com.fasterxml.jackson.databind.JsonNode;
import io.collector.core.Record;

import java.util.Iterator;
import java.util.Map;

final class JsonRecords {
    private JsonRecords() {}

    /** Top-level fields of a JSON object, values kept as JSON trees. */
    static Record fromObject(JsonNode object) {
        Record r = Record.empty();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            r.put(e.getKey(), e.getValue());
        }
        return r;
    }
}
