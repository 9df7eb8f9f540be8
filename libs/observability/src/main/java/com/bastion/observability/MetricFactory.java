package com.bastion.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.ToDoubleFunction;

/**
 * Factory for Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Wraps {@link MeterRegistry} to keep meter naming and tagging consistent across Bastion
 * modules. Meters are registered idempotently, so asking twice for the same name and tags
 * returns the same meter.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** A factory backed by an in-memory registry, for components built without a registry. */
    public static MetricFactory inMemory(String serviceName) {
        return new MetricFactory(new SimpleMeterRegistry(), serviceName);
    }

    /**
     * @param name        metric name (e.g., "bastion.auth.validation")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples {@code target} through {@code valueFunction}. The registry
     * holds {@code target} weakly, so the caller must keep it reachable.
     */
    public <T> T gauge(String name, String description, T target, ToDoubleFunction<T> valueFunction,
                       String... tags) {
        Gauge.builder(name, target, valueFunction)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return target;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
