package io.collector.retry;

import io.collector.fetch.FetchException;

/**
 * Doubles the wait after every failed attempt, starting from the interval of the failure kind
 * (no-response or transport) and never exceeding the cap. A maxAttempts of 0 retries forever.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private static final int MAX_DOUBLINGS = 20;

    private final int maxAttempts;
    private final long transportBaseMillis;
    private final long noResponseBaseMillis;
    private final long capMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long transportBaseMillis, long noResponseBaseMillis,
                                         long capMillis) {
        this.maxAttempts = Math.max(0, maxAttempts);
        this.transportBaseMillis = Math.max(0, transportBaseMillis);
        this.noResponseBaseMillis = Math.max(0, noResponseBaseMillis);
        this.capMillis = Math.max(0, capMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return maxAttempts == 0 || attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt, Exception e) {
        boolean noResponse = e instanceof FetchException fe && fe.kind() == FetchException.Kind.NO_RESPONSE;
        long base = noResponse ? noResponseBaseMillis : transportBaseMillis;
        int doublings = Math.min(MAX_DOUBLINGS, Math.max(0, attempt - 1));
        return Math.min(base << doublings, capMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
