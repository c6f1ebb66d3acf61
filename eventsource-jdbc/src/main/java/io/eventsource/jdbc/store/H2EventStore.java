package io.eventsource.jdbc.store;

import io.eventsource.spi.ConnectionProvider;

import java.time.Duration;
import java.util.List;

/**
 * H2 event store. Primarily for testing.
 *
 * <p>Concurrent appends wait on the sequence row lock; give the database a
 * {@code LOCK_TIMEOUT} longer than the slowest append.
 */
public final class H2EventStore extends AbstractJdbcEventStore {

  public H2EventStore() {
    super();
  }

  public H2EventStore(ConnectionProvider connectionProvider, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    super(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected AbstractJdbcEventStore newInstance(ConnectionProvider connectionProvider,
      String tableName, String sequenceTableName, Duration queryTimeout) {
    return new H2EventStore(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  protected String textColumnType() {
    return "CLOB";
  }

  @Override
  protected String timestampColumnType() {
    return "TIMESTAMP(6)";
  }

  @Override
  protected String seedSequenceSql() {
    return "INSERT INTO " + sequenceTableName() + " (id, last_sequence) "
        + "SELECT 1, 0 WHERE NOT EXISTS (SELECT 1 FROM " + sequenceTableName() + " WHERE id = 1)";
  }
}
