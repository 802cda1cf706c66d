package io.collector.runtime;

import java.time.Duration;

/**
 * Running arithmetic mean of chunk durations and the remaining-time estimate derived from it.
 */
final class BatchProgress {
    private final int totalChunks;
    private int completed;
    private long totalNanos;

    BatchProgress(int totalChunks) {
        this.totalChunks = totalChunks;
    }

    void record(Duration chunkTime) {
        completed++;
        totalNanos += chunkTime.toNanos();
    }

    int completed() { return completed; }
    int remainingChunks() { return Math.max(0, totalChunks - completed); }

    Duration mean() {
        return completed == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / completed);
    }

    Duration estimateRemaining() {
        return mean().multipliedBy(remainingChunks());
    }

    /** H:MM:SS, rounded to the nearest second. */
    static String format(Duration d) {
        long seconds = Math.round(d.toMillis() / 1000.0);
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
