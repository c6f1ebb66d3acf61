package io.eventsource;

/**
 * Marker for domain events produced by aggregates.
 *
 * <p>Implementations are immutable (records are the norm) and belong to a closed
 * hierarchy per aggregate, e.g. a sealed interface with one record per event type.
 */
public interface DomainEvent {

  /**
   * Returns the type tag persisted alongside the payload, e.g. {@code "campaign.created"}.
   */
  String eventType();
}
