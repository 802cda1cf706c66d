package io.collector.fetch;

import java.io.IOException;

/**
 * A failed request. Inside the fetcher these are transient and retried; one escaping the fetcher means
 * the retry policy gave up.
 */
public class FetchException extends IOException {
    public enum Kind {
        /** Connection, TLS or timeout failure before a response arrived. */
        TRANSPORT,
        /** Empty body or non-2xx status, typically the upstream rate limiter. */
        NO_RESPONSE,
        /** Body arrived but is not valid JSON. */
        MALFORMED
    }

    private final Kind kind;
    private final int attempts;

    public FetchException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, 1);
    }

    public FetchException(Kind kind, String message, Throwable cause, int attempts) {
        super(message, cause);
        this.kind = kind;
        this.attempts = attempts;
    }

    public Kind kind() { return kind; }
    public int attempts() { return attempts; }
}
