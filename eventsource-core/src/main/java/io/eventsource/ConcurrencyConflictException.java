package io.eventsource;

/**
 * Thrown by {@link io.eventsource.spi.EventStore#append} when the stream's current
 * version does not match the version the writer expected.
 *
 * <p>Recoverable: the caller reloads the aggregate, re-applies its intent against
 * the fresh state and saves again.
 */
public final class ConcurrencyConflictException extends EventSourcingException {
  private final String streamId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
    super("Concurrency conflict on stream " + streamId
        + ": expected version " + expectedVersion + ", actual " + describe(actualVersion));
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public ConcurrencyConflictException(String streamId, long expectedVersion, Throwable cause) {
    super("Concurrency conflict on stream " + streamId
        + ": version " + (expectedVersion + 1) + " was written concurrently", cause);
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = -1L;
  }

  public String streamId() {
    return streamId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }

  /**
   * Returns the version observed at append time, or {@code -1} when the conflict was
   * detected by the store's unique constraint and the winner's version is unknown.
   */
  public long actualVersion() {
    return actualVersion;
  }

  private static String describe(long actualVersion) {
    return actualVersion < 0 ? "unknown" : String.valueOf(actualVersion);
  }
}
