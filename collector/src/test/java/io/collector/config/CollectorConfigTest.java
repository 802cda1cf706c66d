package io.collector.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class CollectorConfigTest {
    @AfterEach
    void clearProps() {
        System.clearProperty("collector.batchSize");
        System.clearProperty("collector.maxAttempts");
        System.clearProperty("collector.backoff");
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("collector.batchSize", "25");
        System.setProperty("collector.maxAttempts", "4");
        System.setProperty("collector.backoff", "Exponential");
        CollectorConfig c = CollectorConfig.fromEnv();
        assertEquals(CollectorConfig.Backoff.EXPONENTIAL, c.backoff());
        assertEquals(25, c.batchSize());
        assertEquals(4, c.maxAttempts());
    }

    @Test
    void withers_replace_one_field() {
        CollectorConfig c = CollectorConfig.fromEnv()
                .withDataDir(Path.of("x"))
                .withPause(Duration.ofMillis(300))
                .withWaits(Duration.ZERO, Duration.ofSeconds(1));
        assertEquals(Path.of("x"), c.dataDir());
        assertEquals(Duration.ofMillis(300), c.pause());
        assertEquals(Duration.ZERO, c.transportWait());
        assertEquals(Duration.ofSeconds(1), c.noResponseWait());
    }

    @Test
    void backoff_defaults_to_fixed() {
        CollectorConfig c = CollectorConfig.fromEnv();
        assertEquals(CollectorConfig.Backoff.FIXED, c.backoff());
        assertEquals(Duration.ofMinutes(5), c.maxBackoff());
    }

    @Test
    void rejects_unknown_backoff() {
        System.setProperty("collector.backoff", "linear");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);
    }

    @Test
    void rejects_invalid_values() {
        CollectorConfig c = CollectorConfig.fromEnv();
        assertThrows(IllegalArgumentException.class, () -> c.withBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> c.withMaxAttempts(-1));
        assertThrows(IllegalArgumentException.class, () -> c.withPause(Duration.ofMillis(-1)));
    }
}
