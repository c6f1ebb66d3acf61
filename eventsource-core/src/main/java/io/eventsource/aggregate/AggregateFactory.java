package io.eventsource.aggregate;

import io.eventsource.DomainEvent;
import io.eventsource.Identifier;

/**
 * Creates an empty aggregate instance for the repository to replay events into.
 */
@FunctionalInterface
public interface AggregateFactory<ID extends Identifier, E extends DomainEvent, A extends AggregateRoot<ID, E>> {

  A newInstance(ID id);
}
