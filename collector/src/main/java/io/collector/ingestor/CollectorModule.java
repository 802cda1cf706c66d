package io.collector.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.collector.config.CollectorConfig;
import io.collector.core.Sleeper;
import io.collector.fetch.Fetcher;
import io.collector.fetch.HttpJsonFetcher;
import io.collector.metrics.Metrics;
import io.collector.retry.ExponentialBackoffRetryPolicy;
import io.collector.retry.FixedDelayRetryPolicy;
import io.collector.retry.RetryPolicy;
import io.collector.runtime.BatchProcessor;

import java.net.http.HttpClient;

public class CollectorModule extends AbstractModule {
    private final CollectorConfig config;

    public CollectorModule(CollectorConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CollectorConfig.class).toInstance(config);
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        long transport = config.transportWait().toMillis();
        long noResponse = config.noResponseWait().toMillis();
        return switch (config.backoff()) {
            case FIXED -> new FixedDelayRetryPolicy(config.maxAttempts(), transport, noResponse);
            case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(config.maxAttempts(), transport, noResponse,
                    config.maxBackoff().toMillis());
        };
    }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides @Singleton Fetcher fetcher(HttpClient http, ObjectMapper mapper, RetryPolicy retry, Sleeper sleeper, Metrics metrics) {
        return new HttpJsonFetcher(http, mapper, retry, sleeper, metrics, config.requestTimeout(), config.userAgent());
    }

    @Provides @Singleton BatchProcessor batchProcessor(Metrics metrics, Sleeper sleeper) {
        return new BatchProcessor(metrics, sleeper);
    }
}
