package io.collector.checkpoint;

import java.io.IOException;

/**
 * Durable single-integer cursor: the index of the next item that has not been written yet.
 */
public interface CheckpointStore {
    /** Stored cursor, or 0 when nothing has been saved. */
    long load() throws IOException;

    /** Replaces the stored cursor. */
    void save(long cursor) throws IOException;

    /** Forces the next run to start from the first item. */
    default void reset() throws IOException {
        save(0);
    }
}
