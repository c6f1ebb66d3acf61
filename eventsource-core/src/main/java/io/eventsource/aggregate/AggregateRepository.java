package io.eventsource.aggregate;

import io.eventsource.AggregateNotFoundException;
import io.eventsource.ConcurrencyConflictException;
import io.eventsource.DomainEvent;
import io.eventsource.Identifier;
import io.eventsource.NewEvent;
import io.eventsource.model.StoredEvent;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads aggregates by replaying their stream and saves them by appending their pending
 * events under the version they were loaded at.
 *
 * <p>A save that loses the race against another writer fails with
 * {@link ConcurrencyConflictException} and leaves the aggregate untouched. Nothing is
 * merged: the caller reloads, re-runs its command against the fresh state and saves
 * again, which {@link #update} does for it.
 *
 * <p>This class is thread-safe; aggregate instances are not.
 *
 * @param <ID> identifier type
 * @param <E>  event type
 * @param <A>  aggregate type
 */
public final class AggregateRepository<ID extends Identifier, E extends DomainEvent, A extends AggregateRoot<ID, E>> {
  private static final Logger logger = Logger.getLogger(AggregateRepository.class.getName());

  private final EventStore eventStore;
  private final EventCodec<E> codec;
  private final AggregateFactory<ID, E, A> factory;
  private final MetricsExporter metrics;

  public AggregateRepository(EventStore eventStore, EventCodec<E> codec, AggregateFactory<ID, E, A> factory) {
    this(eventStore, codec, factory, MetricsExporter.NOOP);
  }

  public AggregateRepository(EventStore eventStore, EventCodec<E> codec,
      AggregateFactory<ID, E, A> factory, MetricsExporter metrics) {
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Reconstructs an aggregate from its stream.
   *
   * @param id the aggregate id
   * @return the aggregate, or empty when its stream has no events
   * @throws io.eventsource.EventSerializationException if a stored event cannot be decoded
   */
  public Optional<A> find(ID id) {
    Objects.requireNonNull(id, "id");
    List<StoredEvent> stream = eventStore.loadStream(id.value());
    if (stream.isEmpty()) {
      return Optional.empty();
    }
    A aggregate = factory.newInstance(id);
    for (StoredEvent stored : stream) {
      aggregate.replay(codec.decode(stored), stored.version());
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Loaded " + id.value() + " at version " + aggregate.version());
    }
    return Optional.of(aggregate);
  }

  /**
   * Same as {@link #find} but treats a missing stream as an error.
   *
   * @throws AggregateNotFoundException if the stream has no events
   */
  public A load(ID id) {
    return find(id).orElseThrow(() -> new AggregateNotFoundException(id.value()));
  }

  /**
   * Appends the aggregate's pending events, expecting the stream to still be at the
   * aggregate's version. No-op when nothing is pending.
   *
   * @throws ConcurrencyConflictException         if another writer appended first
   * @throws io.eventsource.StoreUnavailableException on timeout; reload before retrying
   */
  public void save(A aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    List<E> pending = aggregate.pendingEvents();
    if (pending.isEmpty()) {
      return;
    }
    List<NewEvent> encoded = new ArrayList<>(pending.size());
    for (E event : pending) {
      encoded.add(codec.encode(event));
    }
    String streamId = aggregate.id().value();
    long newVersion;
    try {
      newVersion = eventStore.append(streamId, aggregate.version(), encoded);
    } catch (ConcurrencyConflictException e) {
      metrics.incrementConflicts();
      throw e;
    }
    aggregate.markCommitted(newVersion);
    metrics.incrementAppended(encoded.size());
  }

  /**
   * Loads, runs a command and saves, reloading and re-running the command when the save
   * hits a concurrency conflict.
   *
   * <p>The command must derive its events from the aggregate it is given; it runs once
   * per attempt against freshly loaded state and may throw to reject the change.
   *
   * @param id          the aggregate id
   * @param command     the command to run
   * @param maxAttempts total attempts before the last conflict is rethrown (&ge; 1)
   * @return the command's result from the successful attempt
   * @throws AggregateNotFoundException   if the aggregate does not exist
   * @throws ConcurrencyConflictException if every attempt conflicted
   */
  public <R> R update(ID id, Function<A, R> command, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(command, "command");
    for (int attempt = 1; ; attempt++) {
      A aggregate = load(id);
      R result = command.apply(aggregate);
      try {
        save(aggregate);
        return result;
      } catch (ConcurrencyConflictException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        logger.log(Level.FINE, "Conflict saving " + id.value() + ", retrying (attempt " + attempt + ")", e);
      }
    }
  }
}
