package io.eventsource.jdbc.tx;

import io.eventsource.jdbc.JdbcTemplate;
import io.eventsource.spi.UnitOfWork;

import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link UnitOfWork} that runs the work inside one JDBC transaction bound to the
 * calling thread. Stores built with the same {@link ThreadLocalTxContext} join it, so a
 * read-model write and a checkpoint write commit or roll back together.
 *
 * <p>Work started while a transaction is already active joins that transaction and
 * leaves commit to its owner.
 */
public final class JdbcUnitOfWork implements UnitOfWork {
  private final JdbcTransactionManager txManager;

  public JdbcUnitOfWork(JdbcTransactionManager txManager) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
  }

  @Override
  public void execute(Work work) throws Exception {
    Objects.requireNonNull(work, "work");
    if (txManager.txContext().isTransactionActive()) {
      work.run();
      return;
    }
    JdbcTransactionManager.Transaction tx;
    try {
      tx = txManager.begin();
    } catch (SQLException e) {
      throw JdbcTemplate.translate("begin transaction", e);
    }
    try (tx) {
      work.run();
      try {
        tx.commit();
      } catch (SQLException e) {
        throw JdbcTemplate.translate("commit transaction", e);
      }
    }
  }
}
