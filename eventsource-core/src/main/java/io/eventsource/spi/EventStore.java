package io.eventsource.spi;

import io.eventsource.NewEvent;
import io.eventsource.model.StoredEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Append-only, versioned, per-stream event log with optimistic concurrency.
 *
 * <p>Writers to different streams never block each other beyond the short critical
 * section that assigns global sequence numbers. Writers to the same stream are
 * serialized by the expected-version check: exactly one of two concurrent appends with
 * the same {@code expectedVersion} succeeds.
 *
 * <p>Implementations live in the {@code eventsource-jdbc} module; an in-memory variant
 * is provided by {@link io.eventsource.memory.InMemoryEventStore}.
 */
public interface EventStore {

  /**
   * Creates the backing schema if missing. Idempotent; safe to call on every start.
   */
  void initialize();

  /**
   * Atomically appends events to a stream.
   *
   * <p>Events receive consecutive versions starting at {@code expectedVersion + 1} and
   * consecutive global sequences consistent with commit order across all streams.
   *
   * @param streamId        the stream (aggregate) id
   * @param expectedVersion the version the caller last observed; {@code 0} means the
   *                        stream must not exist yet
   * @param events          events to append, in order; must not be empty
   * @return the stream version after the append
   * @throws io.eventsource.ConcurrencyConflictException if the current version differs
   * @throws io.eventsource.DuplicateEventException       if an event id is already stored or
   *                                                      repeats within the batch
   * @throws io.eventsource.StoreUnavailableException     on timeout or transient failure;
   *                                                      the outcome is then unknown
   */
  long append(String streamId, long expectedVersion, List<NewEvent> events);

  /**
   * Loads a whole stream, ascending by version. Returns an empty list when the stream
   * does not exist.
   */
  default List<StoredEvent> loadStream(String streamId) {
    return loadStream(streamId, 1L);
  }

  /**
   * Loads a stream starting at {@code fromVersion} (inclusive), ascending by version.
   */
  List<StoredEvent> loadStream(String streamId, long fromVersion);

  /**
   * Returns the current version of a stream, {@code 0} when it does not exist.
   */
  long currentVersion(String streamId);

  /**
   * Reads committed events across all streams, ascending by global sequence.
   *
   * @param fromGlobalSequence first global sequence to return (inclusive)
   * @param limit              maximum number of events to return
   */
  List<StoredEvent> readAll(long fromGlobalSequence, int limit);

  /**
   * Reads every committed event from {@code fromGlobalSequence} on. Intended for rebuilds
   * and tests; projections page through {@link #readAll(long, int)} instead.
   */
  default List<StoredEvent> readAll(long fromGlobalSequence) {
    return readAll(fromGlobalSequence, Integer.MAX_VALUE);
  }

  /**
   * Reads committed events of the given types, ascending by global sequence. An empty
   * type set means all types.
   *
   * <p>Default pages through {@link #readAll(long, int)} and filters in memory. JDBC
   * implementations push the filter into SQL.
   */
  default List<StoredEvent> readAll(long fromGlobalSequence, int limit, Set<String> eventTypes) {
    if (eventTypes == null || eventTypes.isEmpty()) {
      return readAll(fromGlobalSequence, limit);
    }
    List<StoredEvent> result = new ArrayList<>();
    long from = fromGlobalSequence;
    while (result.size() < limit) {
      List<StoredEvent> page = readAll(from, limit);
      if (page.isEmpty()) {
        break;
      }
      for (StoredEvent event : page) {
        if (eventTypes.contains(event.eventType())) {
          result.add(event);
          if (result.size() == limit) {
            break;
          }
        }
      }
      from = page.get(page.size() - 1).globalSequence() + 1;
    }
    return result;
  }

  /**
   * Returns the highest committed global sequence, {@code 0} for an empty store.
   */
  long headSequence();
}
