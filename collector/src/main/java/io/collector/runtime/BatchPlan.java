package io.collector.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits {@code [start, end)} into consecutive chunks of batchSize; the last chunk is cut to end exactly.
 */
public final class BatchPlan {
    private BatchPlan() {}

    public static List<ChunkRange> chunks(int start, int end, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        if (start < 0 || end < start) throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        List<ChunkRange> out = new ArrayList<>((end - start + batchSize - 1) / batchSize);
        for (int s = start; s < end; s += batchSize) {
            out.add(new ChunkRange(s, Math.min(s + batchSize, end)));
        }
        return out;
    }
}
