package io.snapshots.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    /** Metrics backed by a throwaway registry, for callers that do not report. */
    public static Metrics noop() { return new Metrics(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Metric-safe form of a stage or table name: lower case, spaces and punctuation folded to '_'. */
    public static String sanitize(String name) {
        return name.trim().toLowerCase(java.util.Locale.ROOT).replaceAll("[^a-z0-9.]+", "_");
    }
}
