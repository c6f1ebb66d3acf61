package io.eventsource.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only record of a committed event, as returned by
 * {@link io.eventsource.spi.EventStore#loadStream} and
 * {@link io.eventsource.spi.EventStore#readAll}.
 *
 * <p>{@code version} is the 1-based position inside the stream; {@code globalSequence}
 * is the position in the total commit order across all streams.
 */
public record StoredEvent(
    String eventId,
    String streamId,
    long version,
    long globalSequence,
    String eventType,
    String payload,
    Map<String, String> metadata,
    Instant occurredAt,
    Instant recordedAt
) {
  public StoredEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payload, "payload");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
