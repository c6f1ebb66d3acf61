package io.eventsource.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for store operations that manage their own transactions
 * (appends, reads, checkpoint bookkeeping).
 *
 * <p>Callers are responsible for closing the returned connection.
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
