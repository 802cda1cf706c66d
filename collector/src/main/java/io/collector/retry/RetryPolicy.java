package io.collector.retry;

/**
 * Decides whether a failed attempt is retried and how long to wait first. Attempts are numbered from 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt, Exception e);
}
