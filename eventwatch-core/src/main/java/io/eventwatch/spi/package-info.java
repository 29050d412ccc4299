/**
 * Service provider interfaces connecting the watcher to its backing store.
 *
 * <ul>
 *   <li>{@link io.eventwatch.spi.NotificationSource} / {@link io.eventwatch.spi.NotificationStream}:
 *       the store's publish/subscribe channel</li>
 *   <li>{@link io.eventwatch.spi.RecordFetcher}: reads one record by position</li>
 *   <li>{@link io.eventwatch.spi.ConnectionProvider}: JDBC connections for the above</li>
 *   <li>{@link io.eventwatch.spi.MetricsExporter}: counters and gauges</li>
 * </ul>
 */
package io.eventwatch.spi;
