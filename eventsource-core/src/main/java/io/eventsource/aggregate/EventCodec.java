package io.eventsource.aggregate;

import io.eventsource.DomainEvent;
import io.eventsource.NewEvent;
import io.eventsource.model.StoredEvent;

/**
 * Maps an aggregate's events to and from their stored form.
 *
 * @param <E> the event type
 */
public interface EventCodec<E extends DomainEvent> {

  /**
   * Encodes an event for appending.
   *
   * @throws io.eventsource.EventSerializationException if the event cannot be encoded
   */
  NewEvent encode(E event);

  /**
   * Decodes a committed event. Unrecognised event types decode to the hierarchy's
   * fallback variant rather than failing.
   *
   * @throws io.eventsource.EventSerializationException if a known payload is malformed
   */
  E decode(StoredEvent stored);
}
