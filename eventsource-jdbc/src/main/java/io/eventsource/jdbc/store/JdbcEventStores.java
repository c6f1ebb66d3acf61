package io.eventsource.jdbc.store;

import io.eventsource.jdbc.DataSourceConnectionProvider;
import io.eventsource.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event stores with auto-detection support.
 *
 * <p>Event stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.eventsource.jdbc.store.AbstractJdbcEventStore}. The
 * registered instances are unbound templates; {@link #detect(DataSource)} returns a store
 * bound to the data source.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Detect and bind in one step
 * EventStore store = JdbcEventStores.detect(dataSource);
 *
 * // Look up a dialect by name and bind it yourself
 * EventStore store = JdbcEventStores.get("postgresql")
 *     .bind(new DataSourceConnectionProvider(dataSource));
 * }</pre>
 */
public final class JdbcEventStores {

  private static final List<AbstractJdbcEventStore> STORES;
  private static final Map<String, AbstractJdbcEventStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcEventStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcEventStores() {
  }

  /**
   * Returns all registered event stores.
   */
  public static List<AbstractJdbcEventStore> all() {
    return STORES;
  }

  /**
   * Gets an event store template by name.
   *
   * @param name event store name (case-insensitive)
   * @return the unbound event store
   * @throws IllegalArgumentException if no event store found
   */
  public static AbstractJdbcEventStore get(String name) {
    AbstractJdbcEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown event store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the dialect of a DataSource and returns a store bound to it, using the
   * default table names and no query timeout.
   *
   * @throws IllegalStateException if the database URL cannot be read
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource) {
    return detect(dataSource, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_SEQUENCE_TABLE,
        Duration.ZERO);
  }

  /**
   * Detects the dialect of a DataSource and returns a store bound to it.
   *
   * @param dataSource        the data source
   * @param tableName         event table name
   * @param sequenceTableName global sequence counter table name
   * @param queryTimeout      per-statement timeout, {@link Duration#ZERO} for none
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource, String tableName,
      String sequenceTableName, Duration queryTimeout) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event store from DataSource", e);
    }
    return detect(url).bind(new DataSourceConnectionProvider(dataSource), tableName,
        sequenceTableName, queryTimeout);
  }

  /**
   * Auto-detects an event store template from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the unbound event store
   * @throws IllegalArgumentException if no matching event store found
   */
  public static AbstractJdbcEventStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
