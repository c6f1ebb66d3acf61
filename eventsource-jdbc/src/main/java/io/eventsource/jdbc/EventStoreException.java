package io.eventsource.jdbc;

import io.eventsource.EventSourcingException;

/**
 * Unchecked exception wrapping a non-transient JDBC error raised by the event store,
 * the checkpoint store or a JDBC read-model store.
 *
 * <p>Transient failures (timeouts, lost connections, lock waits) surface as
 * {@link io.eventsource.StoreUnavailableException} instead; see {@link JdbcTemplate}.
 */
public final class EventStoreException extends EventSourcingException {
  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
