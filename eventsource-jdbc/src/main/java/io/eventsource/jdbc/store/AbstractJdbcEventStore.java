package io.eventsource.jdbc.store;

import io.eventsource.ConcurrencyConflictException;
import io.eventsource.DuplicateEventException;
import io.eventsource.Identifier;
import io.eventsource.NewEvent;
import io.eventsource.jdbc.EventStoreException;
import io.eventsource.jdbc.JdbcTemplate;
import io.eventsource.jdbc.TableNames;
import io.eventsource.model.StoredEvent;
import io.eventsource.spi.ConnectionProvider;
import io.eventsource.spi.EventStore;
import io.eventsource.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC event store with standard SQL implementations.
 *
 * <h2>Append protocol</h2>
 * <ol>
 *   <li>Version pre-check in auto-commit mode, so a stale writer fails without locking.</li>
 *   <li>In one transaction: {@code UPDATE es_sequence SET last_sequence = last_sequence + n}.
 *       The row lock is held until commit, which serializes committers and makes
 *       global-sequence order equal to commit order.</li>
 *   <li>Version re-check under the lock, then a batch insert of the events.</li>
 * </ol>
 * A unique-key violation on {@code (stream_id, version)} is the last line and is reported
 * as a {@link ConcurrencyConflictException} as well.
 *
 * <p>Subclasses supply column types and the counter-row seed statement of their
 * database. Instances obtained from {@link java.util.ServiceLoader} (see
 * {@link JdbcEventStores}) are unbound templates; call {@link #bind} to get a usable
 * store. Register custom implementations via
 * {@code META-INF/services/io.eventsource.jdbc.store.AbstractJdbcEventStore}.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcEventStore.class.getName());

  private static final String COLUMNS =
      "global_sequence, event_id, stream_id, version, event_type, payload, metadata, occurred_at, recorded_at";

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final String sequenceTableName;
  private final JdbcTemplate jdbc;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<StoredEvent> rowMapper;

  protected AbstractJdbcEventStore() {
    this(null, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_SEQUENCE_TABLE, Duration.ZERO);
  }

  protected AbstractJdbcEventStore(ConnectionProvider connectionProvider, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    this.connectionProvider = connectionProvider;
    this.tableName = TableNames.validate(tableName);
    this.sequenceTableName = TableNames.validate(sequenceTableName);
    this.jdbc = new JdbcTemplate(queryTimeout == null ? Duration.ZERO : queryTimeout);
    this.jsonCodec = JsonCodec.getDefault();
    this.rowMapper = rs -> new StoredEvent(
        rs.getString("event_id"),
        rs.getString("stream_id"),
        rs.getLong("version"),
        rs.getLong("global_sequence"),
        rs.getString("event_type"),
        rs.getString("payload"),
        jsonCodec.parseObject(rs.getString("metadata")),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getTimestamp("recorded_at").toInstant());
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Creates a store of the same dialect bound to a connection provider.
   */
  protected abstract AbstractJdbcEventStore newInstance(ConnectionProvider connectionProvider,
      String tableName, String sequenceTableName, Duration queryTimeout);

  /** Column type for payload and metadata text. */
  protected abstract String textColumnType();

  /** Column type for {@code occurred_at} and {@code recorded_at}. */
  protected abstract String timestampColumnType();

  /**
   * Inserts the counter row with {@code last_sequence = 0} unless it already exists.
   */
  protected abstract String seedSequenceSql();

  /**
   * Returns a copy of this store bound to a connection provider.
   *
   * @param connectionProvider source of connections for every operation
   * @param tableName          event table name
   * @param sequenceTableName  global sequence counter table name
   * @param queryTimeout       per-statement timeout, {@link Duration#ZERO} for none
   */
  public AbstractJdbcEventStore bind(ConnectionProvider connectionProvider, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    return newInstance(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  public AbstractJdbcEventStore bind(ConnectionProvider connectionProvider) {
    return bind(connectionProvider, tableName, sequenceTableName,
        Duration.ofSeconds(jdbc.queryTimeoutSeconds()));
  }

  protected String tableName() {
    return tableName;
  }

  protected String sequenceTableName() {
    return sequenceTableName;
  }

  protected JdbcTemplate jdbc() {
    return jdbc;
  }

  /**
   * DDL run by {@link #initialize()}, in order. The default covers H2 and PostgreSQL.
   */
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName + " ("
            + "global_sequence BIGINT NOT NULL PRIMARY KEY, "
            + "event_id VARCHAR(64) NOT NULL, "
            + "stream_id VARCHAR(" + Identifier.MAX_LENGTH + ") NOT NULL, "
            + "version BIGINT NOT NULL, "
            + "event_type VARCHAR(128) NOT NULL, "
            + "payload " + textColumnType() + " NOT NULL, "
            + "metadata " + textColumnType() + ", "
            + "occurred_at " + timestampColumnType() + " NOT NULL, "
            + "recorded_at " + timestampColumnType() + " NOT NULL, "
            + "CONSTRAINT uk_" + tableName + "_event_id UNIQUE (event_id), "
            + "CONSTRAINT uk_" + tableName + "_stream_version UNIQUE (stream_id, version))",
        "CREATE INDEX IF NOT EXISTS idx_" + tableName + "_type ON " + tableName
            + " (event_type, global_sequence)",
        "CREATE TABLE IF NOT EXISTS " + sequenceTableName + " ("
            + "id INT NOT NULL PRIMARY KEY, "
            + "last_sequence BIGINT NOT NULL)",
        seedSequenceSql());
  }

  @Override
  public void initialize() {
    try (Connection conn = connection()) {
      conn.setAutoCommit(true);
      for (String statement : schemaStatements()) {
        jdbc.update(conn, statement);
      }
    } catch (SQLException e) {
      throw JdbcTemplate.translate("initialize event store schema", e);
    }
    logger.info("Initialized " + name() + " event store tables " + tableName + ", " + sequenceTableName);
  }

  @Override
  public long append(String streamId, long expectedVersion, List<NewEvent> events) {
    Identifier.requireValid(streamId);
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0");
    }
    try (Connection conn = connection()) {
      conn.setAutoCommit(true);
      long observed = currentVersion(conn, streamId);
      if (observed != expectedVersion) {
        throw new ConcurrencyConflictException(streamId, expectedVersion, observed);
      }

      conn.setAutoCommit(false);
      try {
        long lastSequence = reserveSequences(conn, events.size());
        long actual = currentVersion(conn, streamId);
        if (actual != expectedVersion) {
          conn.rollback();
          throw new ConcurrencyConflictException(streamId, expectedVersion, actual);
        }
        insertEvents(conn, streamId, expectedVersion, lastSequence - events.size() + 1, events);
        conn.commit();
      } catch (RuntimeException e) {
        rollbackQuietly(conn);
        if (!(e instanceof ConcurrencyConflictException) && JdbcTemplate.isIntegrityViolation(e)) {
          throw conflictFromConstraint(streamId, expectedVersion, e);
        }
        throw e;
      } catch (SQLException e) {
        rollbackQuietly(conn);
        throw JdbcTemplate.translate("commit append to stream " + streamId, e);
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw JdbcTemplate.translate("append to stream " + streamId, e);
    }
    long newVersion = expectedVersion + events.size();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Appended " + events.size() + " event(s) to " + streamId + ", now at version " + newVersion);
    }
    return newVersion;
  }

  /**
   * Locks the counter row and moves it forward by {@code count}.
   *
   * @return the last reserved sequence
   */
  private long reserveSequences(Connection conn, int count) {
    int updated = jdbc.update(conn,
        "UPDATE " + sequenceTableName + " SET last_sequence = last_sequence + ? WHERE id = 1", count);
    if (updated != 1) {
      throw new EventStoreException("Sequence table " + sequenceTableName
          + " is not initialized; call initialize() first", null);
    }
    return jdbc.queryForLong(conn, "SELECT last_sequence FROM " + sequenceTableName + " WHERE id = 1");
  }

  private void insertEvents(Connection conn, String streamId, long expectedVersion,
      long firstSequence, List<NewEvent> events) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    Instant recordedAt = Instant.now();
    List<Object[]> rows = new ArrayList<>(events.size());
    for (int i = 0; i < events.size(); i++) {
      NewEvent event = events.get(i);
      rows.add(new Object[]{
          firstSequence + i,
          event.eventId(),
          streamId,
          expectedVersion + i + 1,
          event.eventType(),
          event.payload(),
          jsonCodec.toJson(event.metadata()),
          event.occurredAt(),
          recordedAt});
    }
    jdbc.batchUpdate(conn, sql, rows);
  }

  private RuntimeException conflictFromConstraint(String streamId, long expectedVersion, RuntimeException e) {
    long actual;
    try (Connection conn = connection()) {
      conn.setAutoCommit(true);
      actual = currentVersion(conn, streamId);
    } catch (SQLException | RuntimeException lookup) {
      e.addSuppressed(lookup);
      return new ConcurrencyConflictException(streamId, expectedVersion, e);
    }
    if (actual != expectedVersion) {
      return new ConcurrencyConflictException(streamId, expectedVersion, actual);
    }
    // the stream did not move, so the violated key was the event id
    return new DuplicateEventException(streamId, e);
  }

  @Override
  public List<StoredEvent> loadStream(String streamId, long fromVersion) {
    Objects.requireNonNull(streamId, "streamId");
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE stream_id = ? AND version >= ? ORDER BY version";
    try (Connection conn = connection()) {
      return jdbc.query(conn, sql, rowMapper, streamId, Math.max(1L, fromVersion));
    } catch (SQLException e) {
      throw JdbcTemplate.translate("load stream " + streamId, e);
    }
  }

  @Override
  public long currentVersion(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    try (Connection conn = connection()) {
      return currentVersion(conn, streamId);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("read version of stream " + streamId, e);
    }
  }

  private long currentVersion(Connection conn, String streamId) {
    return jdbc.queryForLong(conn,
        "SELECT MAX(version) FROM " + tableName + " WHERE stream_id = ?", streamId);
  }

  @Override
  public List<StoredEvent> readAll(long fromGlobalSequence, int limit) {
    return readAll(fromGlobalSequence, limit, Collections.emptySet());
  }

  @Override
  public List<StoredEvent> readAll(long fromGlobalSequence, int limit, Set<String> eventTypes) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(tableName)
        .append(" WHERE global_sequence >= ?");
    params.add(fromGlobalSequence);
    if (eventTypes != null && !eventTypes.isEmpty()) {
      sql.append(" AND event_type IN (");
      int i = 0;
      for (String type : eventTypes) {
        sql.append(i++ == 0 ? "?" : ",?");
        params.add(type);
      }
      sql.append(')');
    }
    sql.append(" ORDER BY global_sequence LIMIT ?");
    params.add(limit);
    try (Connection conn = connection()) {
      return jdbc.query(conn, sql.toString(), rowMapper, params.toArray());
    } catch (SQLException e) {
      throw JdbcTemplate.translate("read events from sequence " + fromGlobalSequence, e);
    }
  }

  @Override
  public long headSequence() {
    try (Connection conn = connection()) {
      return jdbc.queryForLong(conn, "SELECT MAX(global_sequence) FROM " + tableName);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("read head sequence", e);
    }
  }

  private Connection connection() throws SQLException {
    if (connectionProvider == null) {
      throw new IllegalStateException("Event store " + name()
          + " is not bound to a connection provider; use bind() or JdbcEventStores.detect()");
    }
    return connectionProvider.getConnection();
  }

  private static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback of failed append failed", e);
    }
  }
}
