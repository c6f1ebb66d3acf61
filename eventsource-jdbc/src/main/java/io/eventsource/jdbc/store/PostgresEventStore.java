package io.eventsource.jdbc.store;

import io.eventsource.spi.ConnectionProvider;

import java.time.Duration;
import java.util.List;

/**
 * PostgreSQL event store.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {

  public PostgresEventStore() {
    super();
  }

  public PostgresEventStore(ConnectionProvider connectionProvider, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    super(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected AbstractJdbcEventStore newInstance(ConnectionProvider connectionProvider,
      String tableName, String sequenceTableName, Duration queryTimeout) {
    return new PostgresEventStore(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  protected String textColumnType() {
    return "TEXT";
  }

  @Override
  protected String timestampColumnType() {
    return "TIMESTAMPTZ";
  }

  @Override
  protected String seedSequenceSql() {
    return "INSERT INTO " + sequenceTableName() + " (id, last_sequence) VALUES (1, 0) "
        + "ON CONFLICT (id) DO NOTHING";
  }
}
