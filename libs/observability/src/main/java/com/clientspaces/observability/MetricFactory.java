package com.clientspaces.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Hands out Micrometer meters tagged with the owning service.
 * <p>
 * Quota and resilience components register meters only through this factory. Tags are limited
 * to bounded values (operation, reason, error kind); tenant ids belong in logs, not in tags.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    /**
     * @param registry    registry the meters are registered with
     * @param serviceName value of the {@value #TAG_SERVICE} tag on every meter
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * Registers the counter, or returns the existing one for the same name and tags.
     *
     * @param tags extra tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    /**
     * Registers the timer, or returns the existing one for the same name and tags.
     *
     * @param tags extra tags as alternating keys and values
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    /** Registry backing the meters, for {@link Timer#start(MeterRegistry)}. */
    public MeterRegistry registry() {
        return registry;
    }
}
