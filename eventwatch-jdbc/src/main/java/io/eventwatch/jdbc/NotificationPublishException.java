package io.eventwatch.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcNotificationPublisher}.
 */
public final class NotificationPublishException extends RuntimeException {
  public NotificationPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
