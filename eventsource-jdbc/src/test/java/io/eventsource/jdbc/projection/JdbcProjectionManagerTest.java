package io.eventsource.jdbc.projection;

import io.eventsource.NewEvent;
import io.eventsource.jdbc.DataSourceConnectionProvider;
import io.eventsource.jdbc.checkpoint.JdbcCheckpointStore;
import io.eventsource.jdbc.store.AbstractJdbcEventStore;
import io.eventsource.jdbc.store.H2EventStore;
import io.eventsource.jdbc.tx.JdbcTransactionManager;
import io.eventsource.jdbc.tx.JdbcUnitOfWork;
import io.eventsource.jdbc.tx.ThreadLocalTxContext;
import io.eventsource.model.ProjectionCheckpoint;
import io.eventsource.model.ProjectionState;
import io.eventsource.model.StoredEvent;
import io.eventsource.projection.PoisonEventManager;
import io.eventsource.projection.Projection;
import io.eventsource.projection.ProjectionManager;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Projection engine over H2 with read model and checkpoint in one transaction.
 */
class JdbcProjectionManagerTest {
  private JdbcDataSource ds;
  private ThreadLocalTxContext txContext;
  private AbstractJdbcEventStore eventStore;
  private JdbcCheckpointStore checkpointStore;
  private JdbcUnitOfWork unitOfWork;
  private final List<ProjectionManager> managers = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:projection_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    txContext = new ThreadLocalTxContext();
    eventStore = new H2EventStore().bind(provider);
    eventStore.initialize();
    checkpointStore = new JdbcCheckpointStore(provider, txContext);
    checkpointStore.initialize();
    unitOfWork = new JdbcUnitOfWork(new JdbcTransactionManager(provider, txContext));
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE applied_event (global_sequence BIGINT PRIMARY KEY, event_type VARCHAR(64))");
    }
  }

  @AfterEach
  void tearDown() {
    managers.forEach(ProjectionManager::close);
  }

  @Test
  void readModelAndCheckpointAdvanceTogether() throws Exception {
    append("c-1", 0, "campaign.created");
    append("c-1", 1, "campaign.renamed");
    ProjectionManager manager = manager(new TableProjection("never"));

    manager.pollNow("applied");

    assertEquals(List.of(1L, 2L), appliedSequences());
    assertEquals(2, checkpointStore.load("applied").lastProcessedSequence());
    assertEquals(ProjectionState.LIVE, manager.status("applied").state());
  }

  @Test
  void failedApplyRollsBackItsReadModelWrite() throws Exception {
    append("c-1", 0, "campaign.created");
    append("c-1", 1, "campaign.broken");
    append("c-1", 2, "campaign.renamed");
    ProjectionManager manager = manager(new TableProjection("campaign.broken"));

    manager.pollNow("applied");

    assertEquals(List.of(1L), appliedSequences(), "write of the failing event was rolled back");
    ProjectionCheckpoint checkpoint = checkpointStore.load("applied");
    assertEquals(1, checkpoint.lastProcessedSequence());
    assertEquals(2L, checkpoint.stalledSequence(), "maxAttempts of 1 stalls on the first failure");
    assertEquals(ProjectionState.STALLED, manager.status("applied").state());
  }

  @Test
  void stallIsPersistedAcrossRestartsAndSkipResumes() throws Exception {
    append("c-1", 0, "campaign.created");
    append("c-1", 1, "campaign.broken");
    append("c-1", 2, "campaign.renamed");
    TableProjection projection = new TableProjection("campaign.broken");
    manager(projection).pollNow("applied");
    managers.remove(0).close();

    ProjectionManager restarted = manager(projection);
    restarted.pollNow("applied");
    assertEquals(ProjectionState.STALLED, restarted.status("applied").state());
    assertEquals(2L, restarted.status("applied").stalledSequence());

    PoisonEventManager poison = new PoisonEventManager(restarted, checkpointStore);
    assertEquals(1, poison.count());
    assertTrue(poison.skip("applied"));
    restarted.pollNow("applied");

    assertEquals(List.of(1L, 3L), appliedSequences());
    assertEquals(3, checkpointStore.load("applied").lastProcessedSequence());
    assertTrue(checkpointStore.findStalled().isEmpty());
  }

  @Test
  void rebuildReplaysIntoAClearedReadModel() throws Exception {
    append("c-1", 0, "campaign.created");
    append("c-2", 0, "campaign.created");
    ProjectionManager manager = manager(new TableProjection("never"));
    manager.pollNow("applied");

    manager.rebuild("applied");
    assertEquals(0, checkpointStore.load("applied").lastProcessedSequence());
    manager.pollNow("applied");

    assertEquals(List.of(1L, 2L), appliedSequences());
  }

  private ProjectionManager manager(Projection projection) {
    ProjectionManager manager = ProjectionManager.builder()
        .eventStore(eventStore)
        .checkpointStore(checkpointStore)
        .unitOfWork(unitOfWork)
        .retryPolicy(attempts -> 0L)
        .maxAttempts(1)
        .projection(projection)
        .build();
    managers.add(manager);
    return manager;
  }

  private void append(String streamId, long expectedVersion, String type) {
    eventStore.append(streamId, expectedVersion, List.of(NewEvent.of(type, "{}")));
  }

  private List<Long> appliedSequences() throws SQLException {
    List<Long> sequences = new ArrayList<>();
    try (Connection conn = ds.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT global_sequence FROM applied_event ORDER BY global_sequence")) {
      while (rs.next()) {
        sequences.add(rs.getLong(1));
      }
    }
    return sequences;
  }

  /**
   * Writes every event into {@code applied_event} through the thread's transaction, then
   * fails for one event type after the write.
   */
  private final class TableProjection implements Projection {
    private final String failingType;

    TableProjection(String failingType) {
      this.failingType = failingType;
    }

    @Override
    public String name() {
      return "applied";
    }

    @Override
    public Set<String> eventTypes() {
      return Set.of();
    }

    @Override
    public void apply(StoredEvent event) throws SQLException {
      try (PreparedStatement ps = txContext.currentConnection().prepareStatement(
          "MERGE INTO applied_event (global_sequence, event_type) KEY (global_sequence) VALUES (?, ?)")) {
        ps.setLong(1, event.globalSequence());
        ps.setString(2, event.eventType());
        ps.executeUpdate();
      }
      if (event.eventType().equals(failingType)) {
        throw new IllegalStateException("cannot project " + event.eventType());
      }
    }

    @Override
    public void reset() throws SQLException {
      try (Statement st = txContext.currentConnection().createStatement()) {
        st.execute("DELETE FROM applied_event");
      }
    }
  }
}
