package io.collector.core;

import java.util.List;

/**
 * Supplies the ordered item list for a run. The order must be stable across runs of the same collection,
 * since the persisted cursor is an index into it.
 */
public interface ItemSource {
    List<Item> load() throws Exception;
}
