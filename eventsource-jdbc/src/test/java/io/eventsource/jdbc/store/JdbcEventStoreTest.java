package io.eventsource.jdbc.store;

import io.eventsource.ConcurrencyConflictException;
import io.eventsource.DuplicateEventException;
import io.eventsource.NewEvent;
import io.eventsource.jdbc.DataSourceConnectionProvider;
import io.eventsource.jdbc.EventStoreException;
import io.eventsource.model.StoredEvent;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreTest {
  private JdbcDataSource dataSource;
  private AbstractJdbcEventStore store;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:events_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    store = new H2EventStore().bind(new DataSourceConnectionProvider(dataSource));
    store.initialize();
  }

  @Test
  void appendThenLoadRoundTripsAllColumns() {
    Instant occurredAt = Instant.parse("2026-03-01T10:15:30.123456Z");
    NewEvent created = NewEvent.builder("campaign.created")
        .payload("{\"name\":\"Spring\"}")
        .metadata(Map.of("actor", "user-7", "correlationId", "req-1"))
        .occurredAt(occurredAt)
        .build();
    NewEvent renamed = NewEvent.of("campaign.renamed", "{\"name\":\"Spring Sale\"}");

    long version = store.append("campaign-1", 0, List.of(created, renamed));

    assertEquals(2, version);
    assertEquals(2, store.currentVersion("campaign-1"));
    List<StoredEvent> stream = store.loadStream("campaign-1");
    assertEquals(2, stream.size());
    StoredEvent first = stream.get(0);
    assertEquals(created.eventId(), first.eventId());
    assertEquals("campaign-1", first.streamId());
    assertEquals(1, first.version());
    assertEquals(1, first.globalSequence());
    assertEquals("campaign.created", first.eventType());
    assertEquals("{\"name\":\"Spring\"}", first.payload());
    assertEquals(Map.of("actor", "user-7", "correlationId", "req-1"), first.metadata());
    assertEquals(occurredAt, first.occurredAt());
    assertNotNull(first.recordedAt());
    assertEquals(2, stream.get(1).version());
    assertTrue(stream.get(1).metadata().isEmpty());
  }

  @Test
  void missingStreamIsEmptyAtVersionZero() {
    assertTrue(store.loadStream("nope").isEmpty());
    assertEquals(0, store.currentVersion("nope"));
    assertEquals(0, store.headSequence());
  }

  @Test
  void loadStreamFromVersion() {
    store.append("s", 0, List.of(NewEvent.of("t", "{}"), NewEvent.of("t", "{}"), NewEvent.of("t", "{}")));

    assertEquals(List.of(2L, 3L), store.loadStream("s", 2).stream().map(StoredEvent::version).toList());
  }

  @Test
  void staleExpectedVersionConflictsAndWritesNothing() {
    store.append("campaign-1", 0, List.of(NewEvent.of("campaign.created", "{}")));

    ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
        () -> store.append("campaign-1", 0, List.of(NewEvent.of("campaign.renamed", "{}"))));

    assertEquals("campaign-1", e.streamId());
    assertEquals(0, e.expectedVersion());
    assertEquals(1, e.actualVersion());
    assertEquals(1, store.headSequence());
    assertEquals(1, store.loadStream("campaign-1").size());
  }

  @Test
  void aheadOfStreamConflicts() {
    ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
        () -> store.append("fresh", 3, List.of(NewEvent.of("t", "{}"))));

    assertEquals(0, e.actualVersion());
  }

  @Test
  void globalSequenceFollowsCommitOrderAcrossStreams() {
    store.append("a", 0, List.of(NewEvent.of("t", "{}")));
    store.append("b", 0, List.of(NewEvent.of("t", "{}"), NewEvent.of("t", "{}")));
    store.append("a", 1, List.of(NewEvent.of("t", "{}")));

    List<StoredEvent> all = store.readAll(1);

    assertEquals(List.of(1L, 2L, 3L, 4L), all.stream().map(StoredEvent::globalSequence).toList());
    assertEquals(List.of("a", "b", "b", "a"), all.stream().map(StoredEvent::streamId).toList());
    assertEquals(List.of(1L, 1L, 2L, 2L), all.stream().map(StoredEvent::version).toList());
    assertEquals(4, store.headSequence());
  }

  @Test
  void readAllPagesByLimit() {
    for (int i = 0; i < 5; i++) {
      store.append("s-" + i, 0, List.of(NewEvent.of("t", "{}")));
    }

    assertEquals(List.of(1L, 2L), store.readAll(1, 2).stream().map(StoredEvent::globalSequence).toList());
    assertEquals(List.of(3L, 4L), store.readAll(3, 2).stream().map(StoredEvent::globalSequence).toList());
    assertEquals(List.of(5L), store.readAll(5, 2).stream().map(StoredEvent::globalSequence).toList());
    assertTrue(store.readAll(6, 2).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> store.readAll(1, 0));
  }

  @Test
  void readAllFiltersByEventTypeInSql() {
    store.append("c-1", 0, List.of(NewEvent.of("campaign.created", "{}"), NewEvent.of("campaign.paused", "{}")));
    store.append("c-2", 0, List.of(NewEvent.of("campaign.created", "{}")));
    store.append("c-1", 2, List.of(NewEvent.of("campaign.resumed", "{}")));

    List<StoredEvent> created = store.readAll(1, 10, Set.of("campaign.created"));
    List<StoredEvent> pauseResume = store.readAll(1, 10, Set.of("campaign.paused", "campaign.resumed"));

    assertEquals(List.of(1L, 3L), created.stream().map(StoredEvent::globalSequence).toList());
    assertEquals(List.of(2L, 4L), pauseResume.stream().map(StoredEvent::globalSequence).toList());
    assertEquals(4, store.readAll(1, 10, Set.of()).size());
  }

  @Test
  void duplicateEventIdIsRejectedWithoutLeavingAGap() {
    NewEvent original = NewEvent.builder("t").eventId("01J0000000000000000000DUP1").payload("{}").build();
    NewEvent copy = NewEvent.builder("t").eventId("01J0000000000000000000DUP1").payload("{}").build();
    store.append("a", 0, List.of(original));

    DuplicateEventException e = assertThrows(DuplicateEventException.class,
        () -> store.append("b", 0, List.of(copy)));
    assertEquals("b", e.streamId());
    assertEquals(0, store.currentVersion("b"));

    store.append("b", 0, List.of(NewEvent.of("t", "{}")));
    assertEquals(List.of(1L, 2L), store.readAll(1).stream().map(StoredEvent::globalSequence).toList());
  }

  @Test
  void duplicateEventIdWithinOneBatchRecordsNothing() {
    NewEvent first = NewEvent.builder("t").eventId("01J0000000000000000000DUP2").payload("{}").build();
    NewEvent second = NewEvent.builder("t").eventId("01J0000000000000000000DUP2").payload("{}").build();

    assertThrows(DuplicateEventException.class, () -> store.append("a", 0, List.of(first, second)));

    assertEquals(0, store.currentVersion("a"));
    assertTrue(store.readAll(1).isEmpty());
  }

  @Test
  void invalidArgumentsAreRejected() {
    List<NewEvent> one = List.of(NewEvent.of("t", "{}"));
    assertThrows(IllegalArgumentException.class, () -> store.append("s", 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> store.append("s", -1, one));
    assertThrows(IllegalArgumentException.class, () -> store.append(" ", 0, one));
    assertThrows(NullPointerException.class, () -> store.append(null, 0, one));
    assertEquals(0, store.headSequence());
  }

  @Test
  void initializeIsIdempotentAndKeepsTheCounter() {
    store.append("s", 0, List.of(NewEvent.of("t", "{}")));

    store.initialize();
    store.append("s", 1, List.of(NewEvent.of("t", "{}")));

    assertEquals(2, store.headSequence());
  }

  @Test
  void customTableNames() throws Exception {
    AbstractJdbcEventStore custom = new H2EventStore().bind(new DataSourceConnectionProvider(dataSource),
        "campaign_event", "campaign_sequence", Duration.ofSeconds(5));
    custom.initialize();

    custom.append("c-1", 0, List.of(NewEvent.of("t", "{}")));

    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM campaign_event")) {
      assertTrue(rs.next());
      assertEquals(1, rs.getInt(1));
    }
    assertEquals(0, store.headSequence());
  }

  @Test
  void unboundTemplateCannotBeUsed() {
    H2EventStore template = new H2EventStore();

    assertThrows(IllegalStateException.class, template::headSequence);
    assertThrows(NullPointerException.class, () -> template.bind(null));
  }

  @Test
  void uninitializedSequenceTableIsReported() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("DELETE FROM es_sequence");
    }

    assertThrows(EventStoreException.class,
        () -> store.append("s", 0, List.of(NewEvent.of("t", "{}"))));
  }

  @Test
  void recordedAtIsNotBeforeOccurredAt() {
    Instant before = Instant.now().minus(1, ChronoUnit.SECONDS);
    store.append("s", 0, List.of(NewEvent.of("t", "{}")));

    StoredEvent event = store.loadStream("s").get(0);
    assertTrue(event.recordedAt().isAfter(before));
  }
}
