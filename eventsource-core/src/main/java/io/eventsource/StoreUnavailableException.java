package io.eventsource;

/**
 * Transient infrastructure failure (timeout, lost connection, lock wait exceeded).
 *
 * <p>Safe to retry. A caller whose append timed out cannot know whether the write
 * committed, so it must re-read the stream version before appending again.
 */
public final class StoreUnavailableException extends EventSourcingException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
