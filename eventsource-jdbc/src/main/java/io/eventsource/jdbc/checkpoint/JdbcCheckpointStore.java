package io.eventsource.jdbc.checkpoint;

import io.eventsource.jdbc.JdbcTemplate;
import io.eventsource.jdbc.TableNames;
import io.eventsource.model.ProjectionCheckpoint;
import io.eventsource.spi.CheckpointStore;
import io.eventsource.spi.ConnectionProvider;
import io.eventsource.spi.TxContext;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC checkpoint store, portable across H2, PostgreSQL and MySQL.
 *
 * <p>{@link #save} and {@link #reset} write through the connection of the transaction
 * active on the calling thread, if any, so they commit together with the read-model
 * write. {@link #markStalled} and {@link #clearStalled} always use their own auto-commit
 * connection: a poison record must survive the rollback of the failed apply.
 *
 * <p>Each projection has exactly one writer (its runner), so rows are created with a
 * plain check-then-insert.
 */
public final class JdbcCheckpointStore implements CheckpointStore {
  private static final Logger logger = Logger.getLogger(JdbcCheckpointStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;
  private final String tableName;
  private final JdbcTemplate jdbc;

  public JdbcCheckpointStore(ConnectionProvider connectionProvider, TxContext txContext) {
    this(connectionProvider, txContext, TableNames.DEFAULT_CHECKPOINT_TABLE, Duration.ZERO);
  }

  /**
   * @param connectionProvider source of connections outside a transaction
   * @param txContext          transaction context to join, may be {@code null}
   * @param tableName          checkpoint table name
   * @param queryTimeout       per-statement timeout, {@link Duration#ZERO} for none
   */
  public JdbcCheckpointStore(ConnectionProvider connectionProvider, TxContext txContext,
      String tableName, Duration queryTimeout) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = txContext;
    this.tableName = TableNames.validate(tableName);
    this.jdbc = new JdbcTemplate(queryTimeout == null ? Duration.ZERO : queryTimeout);
  }

  @Override
  public void initialize() {
    String ddl = "CREATE TABLE IF NOT EXISTS " + tableName + " ("
        + "projection_name VARCHAR(128) NOT NULL PRIMARY KEY, "
        + "last_sequence BIGINT NOT NULL, "
        + "stalled_sequence BIGINT, "
        + "last_error VARCHAR(2000), "
        + "updated_at TIMESTAMP NOT NULL)";
    try (Connection conn = connectionProvider.getConnection()) {
      jdbc.update(conn, ddl);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("initialize checkpoint table", e);
    }
    logger.info("Initialized checkpoint table " + tableName);
  }

  @Override
  public ProjectionCheckpoint load(String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    String sql = "SELECT projection_name, last_sequence, stalled_sequence, last_error, updated_at FROM "
        + tableName + " WHERE projection_name = ?";
    List<ProjectionCheckpoint> rows = inConnection(false, "load checkpoint of " + projectionName,
        conn -> jdbc.query(conn, sql, JdbcCheckpointStore::mapRow, projectionName));
    return rows.isEmpty() ? ProjectionCheckpoint.initial(projectionName) : rows.get(0);
  }

  @Override
  public void save(String projectionName, long lastProcessedSequence) {
    Objects.requireNonNull(projectionName, "projectionName");
    inConnection(true, "save checkpoint of " + projectionName, conn -> {
      ensureRow(conn, projectionName);
      return jdbc.update(conn, "UPDATE " + tableName
              + " SET last_sequence = ?, updated_at = ? WHERE projection_name = ? AND last_sequence < ?",
          lastProcessedSequence, Instant.now(), projectionName, lastProcessedSequence);
    });
  }

  @Override
  public void markStalled(String projectionName, long stalledSequence, String error) {
    Objects.requireNonNull(projectionName, "projectionName");
    inConnection(false, "mark projection " + projectionName + " stalled", conn -> {
      ensureRow(conn, projectionName);
      return jdbc.update(conn, "UPDATE " + tableName
              + " SET stalled_sequence = ?, last_error = ?, updated_at = ? WHERE projection_name = ?",
          stalledSequence, truncate(error), Instant.now(), projectionName);
    });
  }

  @Override
  public void clearStalled(String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    inConnection(false, "clear stall of projection " + projectionName, conn -> jdbc.update(conn,
        "UPDATE " + tableName
            + " SET stalled_sequence = NULL, last_error = NULL, updated_at = ? WHERE projection_name = ?",
        Instant.now(), projectionName));
  }

  @Override
  public void reset(String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    inConnection(true, "reset checkpoint of " + projectionName, conn -> jdbc.update(conn,
        "DELETE FROM " + tableName + " WHERE projection_name = ?", projectionName));
  }

  @Override
  public List<ProjectionCheckpoint> findStalled() {
    String sql = "SELECT projection_name, last_sequence, stalled_sequence, last_error, updated_at FROM "
        + tableName + " WHERE stalled_sequence IS NOT NULL ORDER BY projection_name";
    return inConnection(false, "find stalled projections",
        conn -> jdbc.query(conn, sql, JdbcCheckpointStore::mapRow));
  }

  private void ensureRow(Connection conn, String projectionName) {
    long count = jdbc.queryForLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE projection_name = ?", projectionName);
    if (count == 0) {
      jdbc.update(conn, "INSERT INTO " + tableName
              + " (projection_name, last_sequence, updated_at) VALUES (?, 0, ?)",
          projectionName, Instant.now());
    }
  }

  private <T> T inConnection(boolean joinTransaction, String action, ConnectionCallback<T> callback) {
    if (joinTransaction && txContext != null && txContext.isTransactionActive()) {
      return callback.doInConnection(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate(action, e);
    }
  }

  private static ProjectionCheckpoint mapRow(ResultSet rs) throws SQLException {
    long stalled = rs.getLong("stalled_sequence");
    Long stalledSequence = rs.wasNull() ? null : stalled;
    Timestamp updatedAt = rs.getTimestamp("updated_at");
    return new ProjectionCheckpoint(
        rs.getString("projection_name"),
        rs.getLong("last_sequence"),
        stalledSequence,
        rs.getString("last_error"),
        updatedAt == null ? null : updatedAt.toInstant());
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= 2000) {
      return error;
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Truncating poison error message of " + error.length() + " characters");
    }
    return error.substring(0, 2000);
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }
}
