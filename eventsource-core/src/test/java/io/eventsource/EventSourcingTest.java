package io.eventsource;

import io.eventsource.memory.InMemoryCheckpointStore;
import io.eventsource.memory.InMemoryEventStore;
import io.eventsource.model.ProjectionState;
import io.eventsource.model.StoredEvent;
import io.eventsource.projection.Projection;
import io.eventsource.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventSourcingTest {

  @Test
  void startInitializesThenStartsProjections() throws Exception {
    InMemoryEventStore store = new InMemoryEventStore();
    store.append("s", 0, List.of(NewEvent.of("t", "{}")));
    AtomicInteger initialized = new AtomicInteger();
    List<Long> seen = new CopyOnWriteArrayList<>();

    try (EventSourcing es = EventSourcing.builder()
        .eventStore(store)
        .checkpointStore(new InMemoryCheckpointStore())
        .intervalMs(10)
        .initializer(initialized::incrementAndGet)
        .projection(projection("p", seen))
        .build()) {
      es.start();
      es.start();

      assertEquals(1, initialized.get());
      long deadline = System.currentTimeMillis() + 5_000;
      while (seen.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(List.of(1L), seen);
    }
  }

  @Test
  void projectionsCanBeDrivenManually() {
    InMemoryEventStore store = new InMemoryEventStore();
    List<Long> seen = new CopyOnWriteArrayList<>();
    AtomicInteger initialized = new AtomicInteger();

    try (EventSourcing es = EventSourcing.builder()
        .eventStore(store)
        .checkpointStore(new InMemoryCheckpointStore())
        .initializeSchema(false)
        .startProjections(false)
        .initializer(initialized::incrementAndGet)
        .projection(projection("p", seen))
        .build()) {
      es.start();
      store.append("s", 0, List.of(NewEvent.of("t", "{}"), NewEvent.of("t", "{}")));

      assertEquals(ProjectionState.STOPPED, es.projectionManager().status("p").state());
      es.projectionManager().pollNow("p");

      assertEquals(List.of(1L, 2L), seen);
      assertEquals(0, initialized.get());
      assertTrue(es.poisonEvents().stalled().isEmpty());
    }
  }

  @Test
  void startAfterCloseFails() {
    EventSourcing es = EventSourcing.builder()
        .eventStore(new InMemoryEventStore())
        .checkpointStore(new InMemoryCheckpointStore())
        .build();
    es.close();
    es.close();

    assertThrows(IllegalStateException.class, es::start);
  }

  @Test
  void closeWrapsACheckedMetricsFailure() {
    EventSourcing es = EventSourcing.builder()
        .eventStore(new InMemoryEventStore())
        .checkpointStore(new InMemoryCheckpointStore())
        .metrics(new FailingToCloseMetrics())
        .build();

    EventSourcingException e = assertThrows(EventSourcingException.class, es::close);

    assertEquals("Failed to close metrics", e.getMessage());
    assertInstanceOf(IOException.class, e.getCause());
    es.close();
  }

  private static final class FailingToCloseMetrics implements MetricsExporter, AutoCloseable {
    @Override
    public void incrementAppended(int count) {
    }

    @Override
    public void incrementConflicts() {
    }

    @Override
    public void incrementProjectionApplied(String projectionName) {
    }

    @Override
    public void incrementProjectionRetry(String projectionName) {
    }

    @Override
    public void incrementProjectionPoison(String projectionName) {
    }

    @Override
    public void recordProjectionLag(String projectionName, long lag) {
    }

    @Override
    public void close() throws IOException {
      throw new IOException("registry gone");
    }
  }

  private static Projection projection(String name, List<Long> seen) {
    return new Projection() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Set<String> eventTypes() {
        return Set.of();
      }

      @Override
      public void apply(StoredEvent event) {
        seen.add(event.globalSequence());
      }

      @Override
      public void reset() {
        seen.clear();
      }
    };
  }
}
