package io.eventsource;

/**
 * Base type for all failures surfaced by the event store, repositories and
 * the projection engine.
 */
public class EventSourcingException extends RuntimeException {

  public EventSourcingException(String message) {
    super(message);
  }

  public EventSourcingException(String message, Throwable cause) {
    super(message, cause);
  }
}
