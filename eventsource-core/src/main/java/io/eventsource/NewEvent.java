package io.eventsource;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An encoded domain event waiting to be appended to a stream.
 *
 * <p>Each instance is assigned a ULID-based {@code eventId} by default. The payload is
 * JSON text limited to {@value #MAX_PAYLOAD_BYTES} bytes. Stream position and global
 * sequence are assigned by the store at commit time.
 *
 * @see io.eventsource.spi.EventStore#append
 * @see io.eventsource.aggregate.EventCodec
 */
public final class NewEvent {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;

  private final String eventId;
  private final String eventType;
  private final String payload;
  private final Map<String, String> metadata;
  private final Instant occurredAt;

  private NewEvent(Builder builder) {
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    if (eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    Map<String, String> copy = builder.metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    if (copy.containsKey(null)) {
      throw new IllegalArgumentException("metadata cannot contain null keys");
    }
    if (copy.containsValue(null)) {
      throw new IllegalArgumentException("metadata cannot contain null values");
    }
    this.metadata = copy;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
  }

  public static Builder builder(String eventType) {
    return new Builder(eventType);
  }

  public static NewEvent of(String eventType, String payload) {
    return builder(eventType).payload(payload).build();
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  public String payload() {
    return payload;
  }

  public Map<String, String> metadata() {
    return metadata;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  @Override
  public String toString() {
    return "NewEvent{eventId=" + eventId + ", eventType=" + eventType
        + ", occurredAt=" + occurredAt + "}";
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /** Builder for {@link NewEvent}. */
  public static final class Builder {
    private final String eventType;
    private String eventId;
    private String payload;
    private Map<String, String> metadata;
    private Instant occurredAt;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    /**
     * Overrides the generated ULID. Must be unique across the whole store.
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder payload(String payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Flat string metadata (correlation id, causation id, actor) stored next to the payload.
     */
    public Builder metadata(Map<String, String> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    public NewEvent build() {
      return new NewEvent(this);
    }
  }
}
