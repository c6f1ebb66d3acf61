package io.eventsource;

/**
 * Thrown when an aggregate is loaded whose stream has no events.
 */
public final class AggregateNotFoundException extends EventSourcingException {
  private final String streamId;

  public AggregateNotFoundException(String streamId) {
    super("No events found for stream " + streamId);
    this.streamId = streamId;
  }

  public String streamId() {
    return streamId;
  }
}
