package io.eventwatch.jdbc;

import io.eventwatch.EventRecord;
import io.eventwatch.RecordFetchException;
import io.eventwatch.spi.ConnectionProvider;
import io.eventwatch.spi.RecordFetcher;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link RecordFetcher} reading from an event log table keyed by position.
 *
 * <p>Expected columns: {@code id} (the position, primary key), {@code run_id} (the stream id)
 * and {@code event} (the serialized event). A row whose {@code run_id} differs from the notified
 * stream is treated as not found.
 *
 * <p>Each fetch borrows a connection from the {@link ConnectionProvider} and returns it.
 */
public final class JdbcRecordFetcher implements RecordFetcher {
  private static final Logger logger = Logger.getLogger(JdbcRecordFetcher.class.getName());

  public static final String DEFAULT_TABLE = "event_logs";

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final String selectSql;

  public JdbcRecordFetcher(ConnectionProvider connectionProvider) {
    this(connectionProvider, DEFAULT_TABLE);
  }

  public JdbcRecordFetcher(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = SqlIdentifiers.validate(tableName, "tableName");
    this.selectSql = "SELECT id, run_id, event FROM " + this.tableName + " WHERE id = ?";
  }

  @Override
  public Optional<EventRecord> fetch(String streamId, long position) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
        ps.setLong(1, position);
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) {
            return Optional.empty();
          }
          String runId = rs.getString("run_id");
          if (!streamId.equals(runId)) {
            logger.warning("Record " + position + " in " + tableName + " belongs to stream " + runId
                + ", not " + streamId);
            return Optional.empty();
          }
          return Optional.of(new EventRecord(runId, rs.getLong("id"), rs.getString("event")));
        }
      }
    } catch (SQLException e) {
      throw new RecordFetchException("Failed to fetch record " + position + " from " + tableName, e);
    }
  }

  public String tableName() {
    return tableName;
  }
}
