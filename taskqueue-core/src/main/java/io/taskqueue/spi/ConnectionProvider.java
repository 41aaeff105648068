package io.taskqueue.spi;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Provides JDBC connections for queue operations (claims, status updates, lookups,
 * stand-alone enqueues).
 *
 * <p>Callers are responsible for closing the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Provider that opens every connection from {@code dataSource}.
   */
  static ConnectionProvider fromDataSource(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
