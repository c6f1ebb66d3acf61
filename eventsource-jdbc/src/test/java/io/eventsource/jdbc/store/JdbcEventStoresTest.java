package io.eventsource.jdbc.store;

import io.eventsource.NewEvent;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoresTest {

  @Test
  void allDialectsAreRegistered() {
    List<String> names = JdbcEventStores.all().stream().map(AbstractJdbcEventStore::name).toList();

    assertTrue(names.containsAll(List.of("h2", "mysql", "postgresql")), names.toString());
  }

  @Test
  void getIsCaseInsensitive() {
    assertInstanceOf(PostgresEventStore.class, JdbcEventStores.get("PostgreSQL"));
    assertInstanceOf(H2EventStore.class, JdbcEventStores.get("h2"));
  }

  @Test
  void getUnknownThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcEventStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertInstanceOf(H2EventStore.class, JdbcEventStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(MySqlEventStore.class, JdbcEventStores.detect("jdbc:mysql://localhost:3306/campaigns"));
    assertInstanceOf(MySqlEventStore.class, JdbcEventStores.detect("jdbc:mariadb://localhost/campaigns"));
    assertInstanceOf(PostgresEventStore.class, JdbcEventStores.detect("JDBC:POSTGRESQL://localhost/campaigns"));
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect("jdbc:sqlserver://x"));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect((String) null));
  }

  @Test
  void detectFromDataSourceReturnsABoundStore() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    AbstractJdbcEventStore store = JdbcEventStores.detect(ds);
    store.initialize();
    store.append("campaign-1", 0, List.of(NewEvent.of("campaign.created", "{}")));

    assertInstanceOf(H2EventStore.class, store);
    assertEquals(1, store.headSequence());
  }
}
