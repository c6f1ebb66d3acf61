package io.eventsource.jdbc.store;

import io.eventsource.Identifier;
import io.eventsource.spi.ConnectionProvider;

import java.time.Duration;
import java.util.List;

/**
 * MySQL/TiDB event store. Also handles MariaDB URLs.
 *
 * <p>MySQL has no {@code CREATE INDEX IF NOT EXISTS}, so the type index is declared inline
 * in the table definition.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {

  public MySqlEventStore() {
    super();
  }

  public MySqlEventStore(ConnectionProvider connectionProvider, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    super(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  protected AbstractJdbcEventStore newInstance(ConnectionProvider connectionProvider,
      String tableName, String sequenceTableName, Duration queryTimeout) {
    return new MySqlEventStore(connectionProvider, tableName, sequenceTableName, queryTimeout);
  }

  @Override
  protected String textColumnType() {
    return "LONGTEXT";
  }

  @Override
  protected String timestampColumnType() {
    return "DATETIME(6)";
  }

  @Override
  protected String seedSequenceSql() {
    return "INSERT IGNORE INTO " + sequenceTableName() + " (id, last_sequence) VALUES (1, 0)";
  }

  @Override
  protected List<String> schemaStatements() {
    String table = tableName();
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + table + " ("
            + "global_sequence BIGINT NOT NULL PRIMARY KEY, "
            + "event_id VARCHAR(64) NOT NULL, "
            + "stream_id VARCHAR(" + Identifier.MAX_LENGTH + ") NOT NULL, "
            + "version BIGINT NOT NULL, "
            + "event_type VARCHAR(128) NOT NULL, "
            + "payload LONGTEXT NOT NULL, "
            + "metadata LONGTEXT, "
            + "occurred_at DATETIME(6) NOT NULL, "
            + "recorded_at DATETIME(6) NOT NULL, "
            + "UNIQUE KEY uk_" + table + "_event_id (event_id), "
            + "UNIQUE KEY uk_" + table + "_stream_version (stream_id, version), "
            + "KEY idx_" + table + "_type (event_type, global_sequence)"
            + ") ENGINE=InnoDB",
        "CREATE TABLE IF NOT EXISTS " + sequenceTableName() + " ("
            + "id INT NOT NULL PRIMARY KEY, "
            + "last_sequence BIGINT NOT NULL"
            + ") ENGINE=InnoDB",
        seedSequenceSql());
  }
}
