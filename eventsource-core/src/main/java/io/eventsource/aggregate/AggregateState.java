package io.eventsource.aggregate;

import io.eventsource.DomainEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Versioning and uncommitted-event bookkeeping embedded in every aggregate.
 *
 * <p>{@code version} counts events that are durably part of the stream. Recorded events
 * stay in the buffer, and do not move the version, until the repository reports a
 * successful commit through {@link #markCommitted(long)}.
 *
 * <p>Not thread-safe; an aggregate instance belongs to one command at a time.
 *
 * @param <E> the aggregate's event type
 */
public final class AggregateState<E extends DomainEvent> {
  private final List<E> pending = new ArrayList<>();
  private long version;

  public long version() {
    return version;
  }

  /**
   * Appends an event to the uncommitted buffer. Does not touch aggregate fields.
   */
  public void recordEvent(E event) {
    pending.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns an immutable snapshot of the uncommitted buffer, in recording order.
   */
  public List<E> pendingEvents() {
    return List.copyOf(pending);
  }

  public boolean hasPendingEvents() {
    return !pending.isEmpty();
  }

  public void clearPendingEvents() {
    pending.clear();
  }

  /**
   * Advances the version after a replayed event has been folded.
   *
   * @throws IllegalStateException if {@code eventVersion} is not the next version
   */
  void replayed(long eventVersion) {
    if (eventVersion != version + 1) {
      throw new IllegalStateException("Stream gap: expected version " + (version + 1)
          + " but replayed " + eventVersion);
    }
    version = eventVersion;
  }

  /**
   * Moves the version to the committed stream version and empties the buffer.
   */
  void markCommitted(long newVersion) {
    if (newVersion != version + pending.size()) {
      throw new IllegalStateException("Committed version " + newVersion + " does not match "
          + version + " + " + pending.size() + " pending events");
    }
    version = newVersion;
    pending.clear();
  }
}
