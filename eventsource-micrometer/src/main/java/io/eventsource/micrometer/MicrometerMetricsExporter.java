package io.eventsource.micrometer;

import io.eventsource.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsource.append.success} events committed by appends</li>
 *   <li>{@code eventsource.append.conflict} appends rejected by optimistic concurrency</li>
 *   <li>{@code eventsource.projection.applied} events applied, tagged {@code projection}</li>
 *   <li>{@code eventsource.projection.retry} failed attempts that will be retried, tagged {@code projection}</li>
 *   <li>{@code eventsource.projection.poison} poison events, tagged {@code projection}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventsource.projection.lag} sequences behind the head of the log, tagged {@code projection}</li>
 * </ul>
 *
 * <p>Projection meters are registered the first time a projection reports.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    static final String PROJECTION_TAG = "projection";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter appended;
    private final Counter conflicts;
    private final Map<String, Counter> projectionCounters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> lags = new ConcurrentHashMap<>();
    private final Map<String, Gauge> lagGauges = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "eventsource"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "eventsource");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "campaigns.es"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.appended = Counter.builder(namePrefix + ".append.success")
                .description("Events committed by successful appends")
                .register(registry);
        this.conflicts = Counter.builder(namePrefix + ".append.conflict")
                .description("Appends rejected with a concurrency conflict")
                .register(registry);
    }

    @Override
    public void incrementAppended(int count) {
        if (closed) {
            return;
        }
        appended.increment(count);
    }

    @Override
    public void incrementConflicts() {
        if (closed) {
            return;
        }
        conflicts.increment();
    }

    @Override
    public void incrementProjectionApplied(String projectionName) {
        if (closed) {
            return;
        }
        projectionCounter("applied", projectionName, "Events applied by the projection").increment();
    }

    @Override
    public void incrementProjectionRetry(String projectionName) {
        if (closed) {
            return;
        }
        projectionCounter("retry", projectionName, "Failed apply attempts that will be retried").increment();
    }

    @Override
    public void incrementProjectionPoison(String projectionName) {
        if (closed) {
            return;
        }
        projectionCounter("poison", projectionName, "Poison events that stalled the projection").increment();
    }

    @Override
    public void recordProjectionLag(String projectionName, long lag) {
        if (closed) {
            return;
        }
        AtomicLong value = lags.computeIfAbsent(projectionName, name -> {
            AtomicLong holder = new AtomicLong();
            lagGauges.put(name, Gauge.builder(namePrefix + ".projection.lag", holder, AtomicLong::get)
                    .description("Global sequences between the checkpoint and the head of the log")
                    .tag(PROJECTION_TAG, name)
                    .register(registry));
            return holder;
        });
        value.set(lag);
    }

    private Counter projectionCounter(String suffix, String projectionName, String description) {
        return projectionCounters.computeIfAbsent(suffix + ':' + projectionName,
                key -> Counter.builder(namePrefix + ".projection." + suffix)
                        .description(description)
                        .tag(PROJECTION_TAG, projectionName)
                        .register(registry));
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link io.eventsource.EventSourcing} instance is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>();
        meters.add(appended);
        meters.add(conflicts);
        meters.addAll(projectionCounters.values());
        meters.addAll(lagGauges.values());
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
