/**
 * Root API for eventwatch: push notification of records appended to a relational event log,
 * driven by the store's publish/subscribe channel instead of table polling.
 *
 * <h2>Core Design</h2>
 * <p>Producers append a record and then publish {@code "{streamId}_{position}"} on a channel.
 * An {@link io.eventwatch.EventWatcher} listens on that channel from a single background thread,
 * decodes each payload, fetches the record once through a
 * {@link io.eventwatch.spi.RecordFetcher} and hands it to every
 * {@link io.eventwatch.WatchCallback} registered for the stream whose cursor admits the position.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventwatch-core</b>: watcher, registry, watch loop, SPI (zero external deps)</li>
 *   <li><b>eventwatch-jdbc</b>: PostgreSQL {@code LISTEN} source, JDBC record fetcher and publisher</li>
 *   <li><b>eventwatch-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>eventwatch-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * try (EventWatcher watcher = EventWatcher.builder()
 *     .notificationSource(new PostgresNotificationSource(connProvider, Duration.ofMillis(250)))
 *     .recordFetcher(new JdbcRecordFetcher(connProvider))
 *     .build()) {
 *
 *     WatchCallback callback = record -> System.out.println(record.eventJson());
 *     watcher.watch("run-1", 0L, callback);
 *     ...
 *     watcher.unwatch("run-1", callback);
 * }
 * }</pre>
 *
 * @see io.eventwatch.EventWatcher
 * @see io.eventwatch.WatchCallback
 * @see io.eventwatch.EventRecord
 */
package io.eventwatch;
