package io.eventsource.memory;

import io.eventsource.ConcurrencyConflictException;
import io.eventsource.DuplicateEventException;
import io.eventsource.Identifier;
import io.eventsource.NewEvent;
import io.eventsource.model.StoredEvent;
import io.eventsource.spi.EventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link EventStore} backed by in-process lists. Appends are serialized on the store
 * monitor, which makes global sequence order equal to commit order.
 *
 * <p>Nothing survives the JVM; meant for tests and single-process tooling.
 */
public final class InMemoryEventStore implements EventStore {
  private final List<StoredEvent> log = new ArrayList<>();
  private final Map<String, List<StoredEvent>> streams = new HashMap<>();
  private final Set<String> eventIds = new HashSet<>();

  @Override
  public void initialize() {
  }

  @Override
  public synchronized long append(String streamId, long expectedVersion, List<NewEvent> events) {
    Identifier.requireValid(streamId);
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0");
    }
    List<StoredEvent> stream = streams.getOrDefault(streamId, List.of());
    long actual = stream.size();
    if (actual != expectedVersion) {
      throw new ConcurrencyConflictException(streamId, expectedVersion, actual);
    }
    Set<String> batchIds = new HashSet<>();
    for (NewEvent event : events) {
      if (eventIds.contains(event.eventId()) || !batchIds.add(event.eventId())) {
        throw new DuplicateEventException(streamId, event.eventId());
      }
    }
    Instant recordedAt = Instant.now();
    List<StoredEvent> appended = new ArrayList<>(events.size());
    long version = expectedVersion;
    for (NewEvent event : events) {
      version++;
      appended.add(new StoredEvent(event.eventId(), streamId, version, log.size() + appended.size() + 1L,
          event.eventType(), event.payload(), event.metadata(), event.occurredAt(), recordedAt));
    }
    log.addAll(appended);
    streams.computeIfAbsent(streamId, k -> new ArrayList<>()).addAll(appended);
    for (StoredEvent event : appended) {
      eventIds.add(event.eventId());
    }
    return version;
  }

  @Override
  public synchronized List<StoredEvent> loadStream(String streamId, long fromVersion) {
    List<StoredEvent> stream = streams.get(streamId);
    if (stream == null) {
      return List.of();
    }
    int from = (int) Math.max(0L, Math.min(stream.size(), fromVersion - 1));
    return List.copyOf(stream.subList(from, stream.size()));
  }

  @Override
  public synchronized long currentVersion(String streamId) {
    List<StoredEvent> stream = streams.get(streamId);
    return stream == null ? 0L : stream.size();
  }

  @Override
  public synchronized List<StoredEvent> readAll(long fromGlobalSequence, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    int from = (int) Math.max(0L, Math.min(log.size(), fromGlobalSequence - 1));
    int to = (int) Math.min(log.size(), (long) from + limit);
    return List.copyOf(log.subList(from, to));
  }

  @Override
  public synchronized long headSequence() {
    return log.size();
  }
}
