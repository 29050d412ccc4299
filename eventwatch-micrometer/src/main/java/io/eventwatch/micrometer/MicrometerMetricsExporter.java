package io.eventwatch.micrometer;

import io.eventwatch.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventwatch.notifications.received}: payloads read from the channel</li>
 *   <li>{@code eventwatch.notifications.malformed}: payloads that could not be decoded</li>
 *   <li>{@code eventwatch.notifications.ignored}: notifications no subscription wanted</li>
 *   <li>{@code eventwatch.fetch.misses}: notified records that were not found</li>
 *   <li>{@code eventwatch.fetch.failures}: record fetches that failed</li>
 *   <li>{@code eventwatch.records.delivered}: successful callback invocations</li>
 *   <li>{@code eventwatch.callbacks.failed}: callbacks that threw</li>
 *   <li>{@code eventwatch.reconnects}: re-subscriptions after a transport failure</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventwatch.streams.active}: streams with at least one subscription</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter received;
    private final Counter malformed;
    private final Counter ignored;
    private final Counter fetchMisses;
    private final Counter fetchFailures;
    private final Counter delivered;
    private final Counter callbackFailures;
    private final Counter reconnects;
    private final Gauge activeStreamsGauge;

    private final AtomicInteger activeStreams = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "eventwatch"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "eventwatch");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "runs.eventwatch"})
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
        this.received = Counter.builder(namePrefix + ".notifications.received")
                .description("Payloads read from the notification channel")
                .register(registry);
        this.malformed = Counter.builder(namePrefix + ".notifications.malformed")
                .description("Payloads discarded as malformed")
                .register(registry);
        this.ignored = Counter.builder(namePrefix + ".notifications.ignored")
                .description("Notifications with no eligible subscription")
                .register(registry);
        this.fetchMisses = Counter.builder(namePrefix + ".fetch.misses")
                .description("Notified records not found in the store")
                .register(registry);
        this.fetchFailures = Counter.builder(namePrefix + ".fetch.failures")
                .description("Record fetches that failed with a store error")
                .register(registry);
        this.delivered = Counter.builder(namePrefix + ".records.delivered")
                .description("Records handed to a callback")
                .register(registry);
        this.callbackFailures = Counter.builder(namePrefix + ".callbacks.failed")
                .description("Callbacks that threw")
                .register(registry);
        this.reconnects = Counter.builder(namePrefix + ".reconnects")
                .description("Re-subscriptions after a transport failure")
                .register(registry);
        this.activeStreamsGauge = Gauge.builder(namePrefix + ".streams.active", activeStreams, AtomicInteger::get)
                .register(registry);
    }

    @Override
    public void incrementNotificationsReceived() {
        if (closed) return;
        received.increment();
    }

    @Override
    public void incrementNotificationsMalformed() {
        if (closed) return;
        malformed.increment();
    }

    @Override
    public void incrementNotificationsIgnored() {
        if (closed) return;
        ignored.increment();
    }

    @Override
    public void incrementFetchMisses() {
        if (closed) return;
        fetchMisses.increment();
    }

    @Override
    public void incrementFetchFailures() {
        if (closed) return;
        fetchFailures.increment();
    }

    @Override
    public void incrementRecordsDelivered() {
        if (closed) return;
        delivered.increment();
    }

    @Override
    public void incrementCallbackFailures() {
        if (closed) return;
        callbackFailures.increment();
    }

    @Override
    public void incrementReconnects() {
        if (closed) return;
        reconnects.increment();
    }

    @Override
    public void recordActiveStreams(int streams) {
        if (closed) return;
        activeStreams.set(streams);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(received, malformed, ignored, fetchMisses, fetchFailures,
                delivered, callbackFailures, reconnects, activeStreamsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
