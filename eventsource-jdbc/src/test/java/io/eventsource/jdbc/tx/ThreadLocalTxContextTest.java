package io.eventsource.jdbc.tx;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ThreadLocalTxContextTest {

  @Test
  void noTransactionByDefault() {
    ThreadLocalTxContext context = new ThreadLocalTxContext();

    assertFalse(context.isTransactionActive());
    assertThrows(IllegalStateException.class, context::currentConnection);
  }

  @Test
  void bindIsVisibleOnlyToTheBindingThread() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:ctx_" + UUID.randomUUID());
    ThreadLocalTxContext context = new ThreadLocalTxContext();

    try (Connection conn = ds.getConnection()) {
      context.bind(conn);
      assertSame(conn, context.currentConnection());
      assertThrows(IllegalStateException.class, () -> context.bind(conn));

      boolean[] seenElsewhere = new boolean[1];
      Thread other = new Thread(() -> seenElsewhere[0] = context.isTransactionActive());
      other.start();
      other.join();
      assertFalse(seenElsewhere[0]);

      context.clear();
      assertFalse(context.isTransactionActive());
    }
  }
}
