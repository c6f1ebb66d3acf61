package io.eventsource.aggregate;

import io.eventsource.DomainEvent;
import io.eventsource.Identifier;

import java.util.List;

/**
 * Base for event-sourced aggregates.
 *
 * <p>Subclasses implement {@link #apply(DomainEvent)} as a fold of one event over their
 * fields, and mutate state from command methods only through {@link #emit}. The same
 * fold runs when an event is freshly emitted and when it is replayed from the store,
 * so a reloaded aggregate is indistinguishable from the one that produced the events.
 *
 * <pre>{@code
 * public void rename(String newName) {
 *   if (status.isTerminal()) {
 *     throw new IllegalStateException("Campaign is closed");
 *   }
 *   emit(new CampaignRenamed(id().value(), newName, Instant.now()));
 * }
 *
 * protected void apply(CampaignEvent event) {
 *   if (event instanceof CampaignRenamed renamed) {
 *     this.name = renamed.name();
 *   }
 * }
 * }</pre>
 *
 * @param <ID> identifier type
 * @param <E>  event type, usually a sealed interface
 * @see AggregateRepository
 */
public abstract class AggregateRoot<ID extends Identifier, E extends DomainEvent> extends Entity<ID> {
  private final AggregateState<E> state = new AggregateState<>();

  protected AggregateRoot(ID id) {
    super(id);
  }

  /**
   * Folds one event into the aggregate's fields. Must not validate or throw for events
   * that were valid when emitted; validation belongs in command methods.
   */
  protected abstract void apply(E event);

  /**
   * Applies a new event and buffers it for the next save.
   */
  protected final void emit(E event) {
    apply(event);
    state.recordEvent(event);
  }

  /**
   * Number of events durably applied to this instance.
   */
  public final long version() {
    return state.version();
  }

  public final List<E> pendingEvents() {
    return state.pendingEvents();
  }

  public final boolean hasPendingEvents() {
    return state.hasPendingEvents();
  }

  public final void clearPendingEvents() {
    state.clearPendingEvents();
  }

  final void replay(E event, long eventVersion) {
    apply(event);
    state.replayed(eventVersion);
  }

  final void markCommitted(long newVersion) {
    state.markCommitted(newVersion);
  }
}
