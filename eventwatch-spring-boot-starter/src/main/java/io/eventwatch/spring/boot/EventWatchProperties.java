package io.eventwatch.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event watcher.
 *
 * @see EventWatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventwatch")
public class EventWatchProperties {

    /**
     * Notification channel the event log publishes on.
     */
    private String channel = "run_events";

    /**
     * Event log table records are fetched from.
     */
    private String tableName = "event_logs";

    /**
     * How long one notification poll blocks; bounds shutdown latency.
     */
    private Duration pollInterval = Duration.ofMillis(250);

    /**
     * Worker thread name prefix.
     */
    private String threadNamePrefix = "eventwatch-";

    private final Reconnect reconnect = new Reconnect();
    private final Metrics metrics = new Metrics();

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reconnect {
        private boolean enabled = false;
        private long baseDelayMs = 500;
        private long maxDelayMs = 30000;
        private int maxAttempts = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventwatch";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
