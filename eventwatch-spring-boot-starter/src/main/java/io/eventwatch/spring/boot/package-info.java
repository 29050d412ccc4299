/**
 * Spring Boot auto-configuration for eventwatch.
 *
 * <p>Add the starter and a PostgreSQL {@link javax.sql.DataSource}; an
 * {@link io.eventwatch.EventWatcher} bean is created and closed with the context.
 * Properties live under {@code eventwatch.*}, see {@link io.eventwatch.spring.boot.EventWatchProperties}.
 */
package io.eventwatch.spring.boot;
