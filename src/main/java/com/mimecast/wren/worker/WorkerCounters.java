package com.mimecast.wren.worker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker counters.
 *
 * <p>Process lifetime totals backed by Micrometer counters.
 * <br>Owned by one worker and read through {@link #snapshot()}.
 */
public class WorkerCounters {

    public static final String CONSUMED = "consumed";
    public static final String DELIVERED = "delivered";
    public static final String SKIPPED_BOUNCE = "skipped_bounce";
    public static final String RETRIED = "retried";
    public static final String FAILED = "failed";
    public static final String DLQ = "dlq";

    /**
     * Counter names in reporting order.
     */
    public static final List<String> NAMES = List.of(CONSUMED, DELIVERED, SKIPPED_BOUNCE, RETRIED, FAILED, DLQ);

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new LinkedHashMap<>();

    /**
     * Constructs a new WorkerCounters instance with a private registry.
     */
    public WorkerCounters() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Constructs a new WorkerCounters instance.
     *
     * @param registry MeterRegistry instance.
     */
    public WorkerCounters(MeterRegistry registry) {
        this.registry = registry;
        for (String name : NAMES) {
            counters.put(name, Counter.builder("wren.worker." + name.replace('_', '.'))
                    .description("Inbound worker " + name.replace('_', ' ') + " messages")
                    .register(registry));
        }
    }

    /**
     * Increments a counter.
     *
     * @param name Counter name, one of {@link #NAMES}.
     * @throws IllegalArgumentException Unknown counter.
     */
    public void increment(String name) {
        Counter counter = counters.get(name);
        if (counter == null) {
            throw new IllegalArgumentException("Unknown counter: " + name);
        }
        counter.increment();
    }

    /**
     * Gets a counter value.
     *
     * @param name Counter name.
     * @return Value, 0 for unknown names.
     */
    public long get(String name) {
        Counter counter = counters.get(name);
        return counter != null ? (long) counter.count() : 0L;
    }

    /**
     * Gets all counter values in reporting order.
     *
     * @return Unmodifiable map of name to value.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        counters.forEach((name, counter) -> values.put(name, (long) counter.count()));
        return Collections.unmodifiableMap(values);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        snapshot().forEach((name, value) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(name).append("=").append(value);
        });
        return sb.toString();
    }
}
