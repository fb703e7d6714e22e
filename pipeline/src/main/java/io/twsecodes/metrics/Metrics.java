package io.twsecodes.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Counter and timer shortcuts over a {@link MetricRegistry}. A null registry gets a private one,
 * so components built without metrics still count into something.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry == null ? new MetricRegistry() : registry;
    }

    public Timer timer(String name) { return registry.timer(name); }

    public void inc(String name) { registry.counter(name).inc(); }
    public void inc(String name, long n) { registry.counter(name).inc(n); }
    public long count(String name) { return registry.counter(name).getCount(); }
}
