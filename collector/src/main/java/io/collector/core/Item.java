package io.collector.core;

import java.util.Objects;

/**
 * One entry of the ordered item list. The id is opaque to the engine and handed to the parser as-is.
 */
public record Item(String id, String name) {
    public Item {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
    }
}
