package io.eventwatch.jdbc;

import io.eventwatch.EventWatcher;
import io.eventwatch.notify.NotificationPayloads;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Producer-side helper that announces an appended record on a PostgreSQL notification channel.
 *
 * <p>Call {@link #publish} on the connection that inserted the record. PostgreSQL delivers
 * notifications on commit, so inside a transaction the notification goes out only if the insert
 * commits; with auto-commit, call it after the insert.
 */
public final class JdbcNotificationPublisher {
  private final String channel;

  public JdbcNotificationPublisher() {
    this(EventWatcher.DEFAULT_CHANNEL);
  }

  public JdbcNotificationPublisher(String channel) {
    this.channel = SqlIdentifiers.validate(channel, "channel");
  }

  /**
   * Publishes {@code "{streamId}_{position}"} on the channel.
   *
   * @param conn     the connection that appended the record
   * @param streamId the stream the record belongs to
   * @param position the record's position
   * @throws NotificationPublishException if the notification cannot be sent
   */
  public void publish(Connection conn, String streamId, long position) {
    String payload = NotificationPayloads.format(streamId, position);
    try (PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {
      ps.setString(1, channel);
      ps.setString(2, payload);
      ps.execute();
    } catch (SQLException e) {
      throw new NotificationPublishException("Failed to notify " + channel + " with " + payload, e);
    }
  }

  public String channel() {
    return channel;
  }
}
