package io.collector.core;

import java.io.IOException;
import java.util.List;

/** Append-only store receiving one batch of records at a time. */
public interface BatchSink {
    /**
     * Prepares the store for a run resuming at the given cursor. Only a run starting at 0 writes the header.
     */
    void initialize(long cursor) throws IOException;

    /** Appends the batch; once this returns the rows are on disk and survive a process or system crash. */
    void append(List<Record> batch) throws IOException;
}
