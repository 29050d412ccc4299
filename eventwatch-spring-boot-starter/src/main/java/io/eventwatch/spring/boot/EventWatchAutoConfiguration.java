package io.eventwatch.spring.boot;

import io.eventwatch.EventWatcher;
import io.eventwatch.jdbc.DataSourceConnectionProvider;
import io.eventwatch.jdbc.JdbcRecordFetcher;
import io.eventwatch.jdbc.PostgresNotificationSource;
import io.eventwatch.spi.ConnectionProvider;
import io.eventwatch.spi.MetricsExporter;
import io.eventwatch.spi.NotificationSource;
import io.eventwatch.spi.RecordFetcher;
import io.eventwatch.watch.ExponentialBackoffReconnectPolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event watcher.
 *
 * <p>Wires an {@link EventWatcher} listening with {@link PostgresNotificationSource} and fetching
 * with {@link JdbcRecordFetcher}, both on the application {@link DataSource}. Any of the SPI beans
 * can be replaced by declaring one. The watcher starts its worker thread on the first
 * {@code watch} call and is closed with the context.
 *
 * @see EventWatchProperties
 * @see EventWatchMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventWatcher.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventWatchProperties.class)
public class EventWatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(RecordFetcher.class)
    public JdbcRecordFetcher recordFetcher(ConnectionProvider connectionProvider, EventWatchProperties props) {
        return new JdbcRecordFetcher(connectionProvider, props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSource.class)
    public PostgresNotificationSource notificationSource(ConnectionProvider connectionProvider,
                                                         EventWatchProperties props) {
        return new PostgresNotificationSource(connectionProvider, props.getPollInterval());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventWatcher eventWatcher(EventWatchProperties props,
                                     NotificationSource notificationSource,
                                     RecordFetcher recordFetcher,
                                     ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = EventWatcher.builder()
                .notificationSource(notificationSource)
                .recordFetcher(recordFetcher)
                .channel(props.getChannel())
                .threadNamePrefix(props.getThreadNamePrefix());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        var reconnect = props.getReconnect();
        if (reconnect.isEnabled()) {
            builder.reconnectPolicy(new ExponentialBackoffReconnectPolicy(
                    reconnect.getBaseDelayMs(), reconnect.getMaxDelayMs(), reconnect.getMaxAttempts()));
        }
        return builder.build();
    }
}
