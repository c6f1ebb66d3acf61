package io.eventsource.jdbc.tx;

import io.eventsource.spi.TxContext;

import java.sql.Connection;

/**
 * {@link TxContext} implementation that keeps the current transaction's connection in a
 * {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; stores that accept a
 * {@link TxContext} write through {@link #currentConnection()} while a transaction is
 * active on the calling thread.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<Connection> current = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    Connection connection = current.get();
    if (connection == null) {
      throw new IllegalStateException("No active transaction");
    }
    return connection;
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    current.set(connection);
  }

  void clear() {
    current.remove();
  }
}
