package com.aegis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters that always carry a {@code governor} tag.
 * <p>
 * Several governors can share one registry (one per governed estate); the tag keeps their
 * series apart. Gauges are cached by name and tags so repeated lookups update the same value.
 */
public final class MetricFactory {

    /** Tag key identifying the governor instance. */
    public static final String TAG_GOVERNOR = "governor";

    private final MeterRegistry registry;
    private final String governorName;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * @param registry     the Micrometer meter registry
     * @param governorName governor instance name, included on every meter
     */
    public MetricFactory(MeterRegistry registry, String governorName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (governorName == null || governorName.isBlank()) {
            throw new IllegalArgumentException("governorName must not be null or blank");
        }
        this.registry = registry;
        this.governorName = governorName;
    }

    /**
     * Returns the counter with the given name and extra tags (key-value pairs), registering it on
     * first use.
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the value holder behind a gauge, registering the gauge on first use.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags allTags = baseTags(tags);
        return gauges.computeIfAbsent(name + allTags, key -> {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(allTags)
                    .register(registry);
            return value;
        });
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String governorName() {
        return governorName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_GOVERNOR, governorName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
