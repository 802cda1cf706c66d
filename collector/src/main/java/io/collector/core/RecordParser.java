package io.collector.core;

/**
 * Produces the record for one item, usually by fetching it from a remote API.
 * Items the API does not know about should yield a placeholder record rather than an exception.
 */
@FunctionalInterface
public interface RecordParser {
    Record parse(String id, String name) throws Exception;
}
