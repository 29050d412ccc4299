package io.eventwatch.jdbc;

import io.eventwatch.notify.AbstractNotificationStream;
import io.eventwatch.spi.ConnectionProvider;
import io.eventwatch.spi.NotificationSource;
import io.eventwatch.spi.NotificationStream;
import io.eventwatch.watch.CancellationSignal;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link NotificationSource} backed by PostgreSQL {@code LISTEN}.
 *
 * <p>Each stream holds one dedicated connection for its lifetime. The connection is obtained and
 * {@code LISTEN} issued on the first {@code hasNext()}; notifications are then read with
 * {@link PGConnection#getNotifications(int)}, blocking for at most one poll interval. A SQL error
 * while listening ends the stream as failed; it does not reconnect.
 *
 * <p>When the stream ends the channel is {@code UNLISTEN}ed before the connection is closed, so
 * pooled connections go back clean.
 */
public final class PostgresNotificationSource implements NotificationSource {
  private static final Logger logger = Logger.getLogger(PostgresNotificationSource.class.getName());

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);

  private final ConnectionProvider connectionProvider;
  private final long pollIntervalMs;

  public PostgresNotificationSource(ConnectionProvider connectionProvider) {
    this(connectionProvider, DEFAULT_POLL_INTERVAL);
  }

  public PostgresNotificationSource(ConnectionProvider connectionProvider, Duration pollInterval) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(pollInterval, "pollInterval");
    long ms = pollInterval.toMillis();
    if (ms <= 0L || ms > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("pollInterval must be between 1 ms and " + Integer.MAX_VALUE
          + " ms, got: " + pollInterval);
    }
    this.pollIntervalMs = ms;
  }

  @Override
  public NotificationStream subscribe(String channel, CancellationSignal signal) {
    return new ListenStream(SqlIdentifiers.validate(channel, "channel"), signal);
  }

  public Duration pollInterval() {
    return Duration.ofMillis(pollIntervalMs);
  }

  private final class ListenStream extends AbstractNotificationStream {
    private Connection conn;
    private PGConnection pgConn;

    ListenStream(String channel, CancellationSignal signal) {
      super(channel, signal, pollIntervalMs);
    }

    @Override
    protected void open() throws SQLException {
      conn = connectionProvider.getConnection();
      conn.setAutoCommit(true);
      pgConn = conn.unwrap(PGConnection.class);
      try (Statement st = conn.createStatement()) {
        st.execute("LISTEN \"" + channel() + "\"");
      }
    }

    @Override
    protected List<String> poll(long timeoutMs) throws SQLException {
      PGNotification[] notifications = pgConn.getNotifications((int) timeoutMs);
      if (notifications == null || notifications.length == 0) {
        return List.of();
      }
      List<String> payloads = new ArrayList<>(notifications.length);
      for (PGNotification notification : notifications) {
        if (channel().equals(notification.getName())) {
          payloads.add(notification.getParameter());
        }
      }
      return payloads;
    }

    @Override
    protected void release() throws SQLException {
      if (conn == null) {
        return;
      }
      try {
        if (!conn.isClosed()) {
          try (Statement st = conn.createStatement()) {
            st.execute("UNLISTEN \"" + channel() + "\"");
          }
        }
      } catch (SQLException e) {
        logger.log(Level.FINE, "UNLISTEN failed on channel " + channel(), e);
      } finally {
        conn.close();
      }
    }
  }
}
