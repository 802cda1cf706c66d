package io.collector.retry;

import io.collector.fetch.FetchException;

/**
 * Waits a fixed interval between attempts: a longer one when the server gave no usable response
 * (usually rate limiting), a shorter one for transport or decoding failures.
 * A maxAttempts of 0 retries forever.
 */
public class FixedDelayRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long transportWaitMillis;
    private final long noResponseWaitMillis;

    public FixedDelayRetryPolicy(int maxAttempts, long transportWaitMillis, long noResponseWaitMillis) {
        this.maxAttempts = Math.max(0, maxAttempts);
        this.transportWaitMillis = Math.max(0, transportWaitMillis);
        this.noResponseWaitMillis = Math.max(0, noResponseWaitMillis);
    }

    public static FixedDelayRetryPolicy unlimited(long transportWaitMillis, long noResponseWaitMillis) {
        return new FixedDelayRetryPolicy(0, transportWaitMillis, noResponseWaitMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return maxAttempts == 0 || attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt, Exception e) {
        if (e instanceof FetchException fe && fe.kind() == FetchException.Kind.NO_RESPONSE) {
            return noResponseWaitMillis;
        }
        return transportWaitMillis;
    }

    public int maxAttempts() { return maxAttempts; }
}
