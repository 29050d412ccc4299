package io.eventwatch.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for record fetches and notification listening.
 *
 * <p>Callers are responsible for closing the returned connection. A listening
 * {@link NotificationSource} keeps its connection open for the lifetime of the stream.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
