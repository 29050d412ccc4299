/**
 * JDBC and PostgreSQL implementations of the watcher SPI.
 *
 * <ul>
 *   <li>{@link io.eventwatch.jdbc.PostgresNotificationSource}: {@code LISTEN}-based notification source</li>
 *   <li>{@link io.eventwatch.jdbc.JdbcRecordFetcher}: reads one event log row by position</li>
 *   <li>{@link io.eventwatch.jdbc.JdbcNotificationPublisher}: producer-side {@code pg_notify}</li>
 *   <li>{@link io.eventwatch.jdbc.DataSourceConnectionProvider}: adapts a {@link javax.sql.DataSource}</li>
 * </ul>
 */
package io.eventwatch.jdbc;
