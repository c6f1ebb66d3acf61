package io.eventsource;

/**
 * A payload could not be encoded, or a stored payload could not be decoded into
 * the expected event shape. Never retried by the projection engine.
 */
public final class EventSerializationException extends EventSourcingException {

  public EventSerializationException(String message) {
    super(message);
  }

  public EventSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
