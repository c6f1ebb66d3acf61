package io.eventsource.spi;

import java.sql.Connection;

/**
 * Exposes the transaction bound to the current thread so that read-model stores and
 * the checkpoint store can write through the same connection inside a
 * {@link UnitOfWork}.
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();
}
