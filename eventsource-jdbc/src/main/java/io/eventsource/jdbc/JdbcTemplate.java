package io.eventsource.jdbc;

import io.eventsource.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper for the stores in this module.
 *
 * <p>Every statement is given the configured query timeout. {@link SQLException}s never
 * escape: transient ones (timeouts, cancelled queries, lost connections, deadlocks and
 * lock waits) become {@link StoreUnavailableException}, everything else becomes
 * {@link EventStoreException}.
 */
public final class JdbcTemplate {

  /** No statement timeout. */
  public static final JdbcTemplate DEFAULT = new JdbcTemplate(Duration.ZERO);

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final int queryTimeoutSeconds;

  public JdbcTemplate(Duration queryTimeout) {
    if (queryTimeout == null || queryTimeout.isNegative()) {
      throw new IllegalArgumentException("queryTimeout must be >= 0");
    }
    long seconds = queryTimeout.getSeconds() + (queryTimeout.getNano() > 0 ? 1 : 0);
    this.queryTimeoutSeconds = (int) Math.min(Integer.MAX_VALUE, seconds);
  }

  public int queryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  /** Execute UPDATE/INSERT/DELETE/DDL, return rows affected. */
  public int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("execute update", e);
    }
  }

  /** Execute the same statement once per parameter row as a single JDBC batch. */
  public int[] batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    try (PreparedStatement ps = prepare(conn, sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      return ps.executeBatch();
    } catch (SQLException e) {
      throw translate("execute batch", e);
    }
  }

  /** Execute SELECT, map rows. */
  public <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("execute query", e);
    }
  }

  /** Execute a SELECT returning a single number, {@code 0} when it returns no row or NULL. */
  public long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> rows = query(conn, sql, rs -> {
      long value = rs.getLong(1);
      return rs.wasNull() ? 0L : value;
    }, params);
    return rows.isEmpty() ? 0L : rows.get(0);
  }

  private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    if (queryTimeoutSeconds > 0) {
      ps.setQueryTimeout(queryTimeoutSeconds);
    }
    return ps;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  /**
   * Maps a JDBC failure to the store exception hierarchy.
   *
   * @param action what was being attempted, used in the message
   * @param e      the JDBC failure
   * @return a {@link StoreUnavailableException} for transient failures, otherwise an
   *         {@link EventStoreException}
   */
  public static RuntimeException translate(String action, SQLException e) {
    if (isTransient(e)) {
      return new StoreUnavailableException("Failed to " + action + ": " + e.getMessage(), e);
    }
    return new EventStoreException("Failed to " + action, e);
  }

  /**
   * Returns {@code true} for failures that may succeed when retried.
   */
  public static boolean isTransient(SQLException e) {
    if (e instanceof SQLTimeoutException
        || e instanceof SQLTransientException
        || e instanceof SQLRecoverableException) {
      return true;
    }
    String state = e.getSQLState();
    if (state == null) {
      return false;
    }
    // 08 connection exception, 40 rollback (deadlock, serialization), 57014 query canceled,
    // HYT00 timeout expired
    return state.startsWith("08") || state.startsWith("40")
        || "57014".equals(state) || "HYT00".equals(state);
  }

  /**
   * Returns {@code true} if the failure, or its cause, is a unique or other integrity
   * constraint violation (SQLState class 23).
   */
  public static boolean isIntegrityViolation(Throwable t) {
    Throwable current = t;
    while (current != null) {
      if (current instanceof SQLIntegrityConstraintViolationException) {
        return true;
      }
      if (current instanceof SQLException sql) {
        if (sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
          return true;
        }
        // batch failures carry the statement error as the next exception
        if (sql.getNextException() != null && sql.getNextException() != sql
            && isIntegrityViolation(sql.getNextException())) {
          return true;
        }
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }
}
