package io.eventsource.projection;

import io.eventsource.model.StoredEvent;

import java.util.Set;

/**
 * Derives a read model from committed events.
 *
 * <p>{@link #apply} is invoked once per handled event in global-sequence order, inside
 * the same unit of work that advances the projection's checkpoint. Delivery is
 * at-least-once: after a crash between the read-model write and the checkpoint write the
 * same event is applied again, so implementations must be idempotent (typically by
 * ignoring events whose stream version is not newer than the one already stored).
 *
 * <p>A read model is owned by exactly one projection and never written by command code.
 */
public interface Projection {

  /**
   * Unique, stable name; the checkpoint is keyed by it.
   */
  String name();

  /**
   * Event types this projection handles. An empty set subscribes to every type.
   */
  Set<String> eventTypes();

  /**
   * Folds one committed event into the read model.
   *
   * @throws Exception any failure; retried with backoff, then the event is quarantined
   */
  void apply(StoredEvent event) throws Exception;

  /**
   * Deletes all read-model state, ahead of a rebuild from sequence zero.
   */
  void reset() throws Exception;
}
