package io.collector.runtime;

/**
 * Item range {@code [start, stop)} processed and written as one batch.
 */
public record ChunkRange(int start, int stop) {
    public ChunkRange {
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + stop + ")");
        }
    }

    public int size() { return stop - start; }

    @Override
    public String toString() { return "[" + start + ", " + stop + ")"; }
}
