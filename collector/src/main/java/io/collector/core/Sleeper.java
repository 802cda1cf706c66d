package io.collector.core;

import java.time.Duration;

/**
 * Blocking wait used for pacing and retry delays.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) Thread.sleep(duration.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
