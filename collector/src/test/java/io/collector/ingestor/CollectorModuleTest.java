package io.collector.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.collector.config.CollectorConfig;
import io.collector.fetch.Fetcher;
import io.collector.fetch.HttpJsonFetcher;
import io.collector.retry.ExponentialBackoffRetryPolicy;
import io.collector.retry.FixedDelayRetryPolicy;
import io.collector.retry.RetryPolicy;
import io.collector.runtime.BatchProcessor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class CollectorModuleTest {
    private final CollectorConfig config = new CollectorConfig(Path.of("target/module-test"), 10, Duration.ZERO,
            Duration.ofMillis(50), Duration.ofMillis(80), 3, CollectorConfig.Backoff.FIXED, Duration.ofMillis(300),
            Duration.ofSeconds(2), "collector-test");

    @Test
    void wires_singletons() {
        Injector injector = Guice.createInjector(new CollectorModule(config));
        assertSame(injector.getInstance(Fetcher.class), injector.getInstance(Fetcher.class));
        assertInstanceOf(HttpJsonFetcher.class, injector.getInstance(Fetcher.class));
        assertSame(injector.getInstance(BatchProcessor.class), injector.getInstance(BatchProcessor.class));
        assertSame(config, injector.getInstance(CollectorConfig.class));
    }

    @Test
    void retry_policy_follows_config() {
        RetryPolicy policy = Guice.createInjector(new CollectorModule(config)).getInstance(RetryPolicy.class);
        assertInstanceOf(FixedDelayRetryPolicy.class, policy);
        assertTrue(policy.shouldRetry(2, new java.io.IOException("x")));
        assertFalse(policy.shouldRetry(3, new java.io.IOException("x")));
        assertEquals(50, policy.backoffMillis(1, new java.io.IOException("x")));
    }

    @Test
    void exponential_backoff_is_selected_by_config() {
        RetryPolicy policy = Guice.createInjector(new CollectorModule(config.withBackoff(CollectorConfig.Backoff.EXPONENTIAL)))
                .getInstance(RetryPolicy.class);
        assertInstanceOf(ExponentialBackoffRetryPolicy.class, policy);
        assertEquals(50, policy.backoffMillis(1, new java.io.IOException("x")));
        assertEquals(200, policy.backoffMillis(3, new java.io.IOException("x")));
        assertEquals(300, policy.backoffMillis(4, new java.io.IOException("x")));
        assertFalse(policy.shouldRetry(3, new java.io.IOException("x")));
    }

    @Test
    void processor_reports_into_shared_registry() {
        Injector injector = Guice.createInjector(new CollectorModule(config));
        injector.getInstance(BatchProcessor.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertTrue(registry.getNames().contains("collector.batch.time"), registry.getNames().toString());
    }
}
