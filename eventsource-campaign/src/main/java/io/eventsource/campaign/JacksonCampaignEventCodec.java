package io.eventsource.campaign;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.eventsource.EventSerializationException;
import io.eventsource.NewEvent;
import io.eventsource.aggregate.EventCodec;
import io.eventsource.model.StoredEvent;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON codec for {@link CampaignEvent}s.
 *
 * <p>Payloads are the event records serialized by Jackson, with ISO-8601 timestamps.
 * Unrecognised event types decode to {@link CampaignEvent.Unknown}; unknown JSON
 * properties are ignored so older readers tolerate newer payloads.
 */
public final class JacksonCampaignEventCodec implements EventCodec<CampaignEvent> {
  private static final Logger logger = Logger.getLogger(JacksonCampaignEventCodec.class.getName());

  private static final Map<String, Class<? extends CampaignEvent>> TYPES = Map.of(
      CampaignEvent.CREATED, CampaignEvent.Created.class,
      CampaignEvent.UPDATED, CampaignEvent.Updated.class,
      CampaignEvent.RENAMED, CampaignEvent.Renamed.class,
      CampaignEvent.SCHEDULED, CampaignEvent.Scheduled.class,
      CampaignEvent.SENDING_STARTED, CampaignEvent.SendingStarted.class,
      CampaignEvent.PAUSED, CampaignEvent.Paused.class,
      CampaignEvent.RESUMED, CampaignEvent.Resumed.class,
      CampaignEvent.CANCELED, CampaignEvent.Canceled.class,
      CampaignEvent.COMPLETED, CampaignEvent.Completed.class,
      CampaignEvent.FAILED, CampaignEvent.Failed.class);

  private final ObjectMapper mapper;

  public JacksonCampaignEventCodec() {
    this(defaultObjectMapper());
  }

  public JacksonCampaignEventCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Mapper with {@link JavaTimeModule}, ISO-8601 dates and lenient unknown properties.
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Event types this codec decodes to a concrete record.
   */
  public static Set<String> knownTypes() {
    return TYPES.keySet();
  }

  @Override
  public NewEvent encode(CampaignEvent event) {
    Objects.requireNonNull(event, "event");
    if (event instanceof CampaignEvent.Unknown) {
      throw new EventSerializationException("Cannot append unknown event type " + event.eventType());
    }
    String payload;
    try {
      payload = mapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Failed to encode " + event.eventType(), e);
    }
    return NewEvent.builder(event.eventType())
        .payload(payload)
        .occurredAt(event.occurredAt())
        .build();
  }

  @Override
  public CampaignEvent decode(StoredEvent stored) {
    Class<? extends CampaignEvent> type = TYPES.get(stored.eventType());
    if (type == null) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Unknown campaign event type " + stored.eventType() + " at sequence "
            + stored.globalSequence());
      }
      return new CampaignEvent.Unknown(stored.streamId(), stored.eventType(), stored.payload(),
          stored.occurredAt());
    }
    try {
      return mapper.readValue(stored.payload(), type);
    } catch (JsonProcessingException | RuntimeException e) {
      throw new EventSerializationException("Failed to decode " + stored.eventType() + " event "
          + stored.eventId() + " of stream " + stored.streamId(), e);
    }
  }
}
