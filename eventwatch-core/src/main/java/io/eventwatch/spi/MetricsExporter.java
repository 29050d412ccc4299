package io.eventwatch.spi;

/**
 * Observability hook for exporting watcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of payloads received from the notification source.
     */
    void incrementNotificationsReceived();

    /**
     * Increments the count of payloads discarded because they could not be decoded.
     */
    void incrementNotificationsMalformed();

    /**
     * Increments the count of notifications for streams nobody in this process watches.
     */
    void incrementNotificationsIgnored();

    /**
     * Increments the count of notifications whose record could not be found.
     */
    void incrementFetchMisses();

    /**
     * Increments the count of record fetches that failed with a store error.
     */
    void incrementFetchFailures();

    /**
     * Increments the count of records handed to a callback without error.
     */
    void incrementRecordsDelivered();

    /**
     * Increments the count of callbacks that threw.
     */
    void incrementCallbackFailures();

    /**
     * Increments the count of re-subscriptions after a transport failure.
     */
    default void incrementReconnects() {
    }

    /**
     * Records the number of streams that currently have at least one subscription.
     *
     * @param streams active stream count
     */
    void recordActiveStreams(int streams);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementNotificationsReceived() {
        }

        @Override
        public void incrementNotificationsMalformed() {
        }

        @Override
        public void incrementNotificationsIgnored() {
        }

        @Override
        public void incrementFetchMisses() {
        }

        @Override
        public void incrementFetchFailures() {
        }

        @Override
        public void incrementRecordsDelivered() {
        }

        @Override
        public void incrementCallbackFailures() {
        }

        @Override
        public void recordActiveStreams(int streams) {
        }
    }
}
