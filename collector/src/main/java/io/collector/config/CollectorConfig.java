package io.collector.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

public record CollectorConfig(
        Path dataDir,
        int batchSize,
        Duration pause,
        Duration transportWait,
        Duration noResponseWait,
        int maxAttempts,
        Backoff backoff,
        Duration maxBackoff,
        Duration requestTimeout,
        String userAgent
) {
    /** How the wait between fetch attempts evolves. */
    public enum Backoff {
        /** Same wait before every retry. */
        FIXED,
        /** Wait doubles per attempt, capped at maxBackoff. */
        EXPONENTIAL
    }

    public CollectorConfig {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        if (pause.isNegative()) throw new IllegalArgumentException("pause must not be negative");
        if (backoff == null) backoff = Backoff.FIXED;
        if (maxBackoff.isNegative()) throw new IllegalArgumentException("maxBackoff must not be negative");
    }

    public static CollectorConfig fromEnv() {
        Path dataDir = Path.of(prop("collector.dataDir", "COLLECTOR_DATA_DIR", "data/download"));
        int batch = Integer.parseInt(prop("collector.batchSize", "COLLECTOR_BATCH_SIZE", "100"));
        long pause = Long.parseLong(prop("collector.pauseMillis", "COLLECTOR_PAUSE_MILLIS", "1000"));
        long transport = Long.parseLong(prop("collector.transportWaitMillis", "COLLECTOR_TRANSPORT_WAIT_MILLIS", "5000"));
        long noResponse = Long.parseLong(prop("collector.noResponseWaitMillis", "COLLECTOR_NO_RESPONSE_WAIT_MILLIS", "10000"));
        int attempts = Integer.parseInt(prop("collector.maxAttempts", "COLLECTOR_MAX_ATTEMPTS", "0"));
        Backoff backoff = parseBackoff(prop("collector.backoff", "COLLECTOR_BACKOFF", "fixed"));
        long maxBackoff = Long.parseLong(prop("collector.maxBackoffMillis", "COLLECTOR_MAX_BACKOFF_MILLIS", "300000"));
        long timeout = Long.parseLong(prop("collector.requestTimeoutMillis", "COLLECTOR_REQUEST_TIMEOUT_MILLIS", "30000"));
        String ua = prop("collector.userAgent", "COLLECTOR_USER_AGENT", "Mozilla/5.0");
        return new CollectorConfig(dataDir, batch, Duration.ofMillis(pause), Duration.ofMillis(transport),
                Duration.ofMillis(noResponse), attempts, backoff, Duration.ofMillis(maxBackoff),
                Duration.ofMillis(timeout), ua);
    }

    public static Backoff parseBackoff(String name) {
        try {
            return Backoff.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown backoff '" + name + "', expected fixed or exponential", e);
        }
    }

    public CollectorConfig withDataDir(Path dir) {
        return new CollectorConfig(dir, batchSize, pause, transportWait, noResponseWait, maxAttempts, backoff,
                maxBackoff, requestTimeout, userAgent);
    }

    public CollectorConfig withBatchSize(int n) {
        return new CollectorConfig(dataDir, n, pause, transportWait, noResponseWait, maxAttempts, backoff,
                maxBackoff, requestTimeout, userAgent);
    }

    public CollectorConfig withPause(Duration p) {
        return new CollectorConfig(dataDir, batchSize, p, transportWait, noResponseWait, maxAttempts, backoff,
                maxBackoff, requestTimeout, userAgent);
    }

    public CollectorConfig withMaxAttempts(int n) {
        return new CollectorConfig(dataDir, batchSize, pause, transportWait, noResponseWait, n, backoff,
                maxBackoff, requestTimeout, userAgent);
    }

    public CollectorConfig withWaits(Duration transport, Duration noResponse) {
        return new CollectorConfig(dataDir, batchSize, pause, transport, noResponse, maxAttempts, backoff,
                maxBackoff, requestTimeout, userAgent);
    }

    public CollectorConfig withBackoff(Backoff b) {
        return new CollectorConfig(dataDir, batchSize, pause, transportWait, noResponseWait, maxAttempts, b,
                maxBackoff, requestTimeout, userAgent);
    }

    private static String prop(String key, String env, String def) {
        return System.getProperty(key, System.getenv().getOrDefault(env, def));
    }
}
