package io.eventsource;

/**
 * Thrown when an append carries an event id that is already stored, or that appears
 * twice in the same batch. Nothing of the batch is recorded.
 */
public final class DuplicateEventException extends EventSourcingException {
  private final String streamId;

  public DuplicateEventException(String streamId, String eventId) {
    super("Duplicate event id " + eventId + " in append to stream " + streamId);
    this.streamId = streamId;
  }

  public DuplicateEventException(String streamId, Throwable cause) {
    super("Duplicate event id in append to stream " + streamId, cause);
    this.streamId = streamId;
  }

  public String streamId() {
    return streamId;
  }
}
