package io.collector.runtime;

import java.time.Duration;

/** Outcome of a completed run; resumed runs count only what they wrote themselves. */
public record RunSummary(int itemsWritten, int batchesWritten, long finalCursor, Duration elapsed) {}
