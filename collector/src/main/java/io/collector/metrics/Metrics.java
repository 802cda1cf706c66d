package io.collector.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over the shared registry; metric names are prefixed with {@code collector.}.
 */
public class Metrics {
    public static final String PREFIX = "collector.";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(PREFIX + name); }
    public Meter meter(String name) { return registry.meter(PREFIX + name); }
    public Timer timer(String name) { return registry.timer(PREFIX + name); }
}
