package io.eventsource.campaign.readmodel;

import io.eventsource.aggregate.EventCodec;
import io.eventsource.campaign.CampaignDetails;
import io.eventsource.campaign.CampaignEvent;
import io.eventsource.campaign.CampaignStatus;
import io.eventsource.campaign.JacksonCampaignEventCodec;
import io.eventsource.model.StoredEvent;
import io.eventsource.projection.Projection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maintains {@link CampaignReadModel}s from the campaign event stream.
 *
 * <p>Every view records the stream version of the last event folded into it; an event at
 * or below that version has already been applied and is ignored, which makes redelivery
 * after a crash harmless.
 */
public final class CampaignProjection implements Projection {
  private static final Logger logger = Logger.getLogger(CampaignProjection.class.getName());

  public static final String NAME = "campaign-projection";

  private static final Set<String> EVENT_TYPES = Set.of(
      CampaignEvent.CREATED,
      CampaignEvent.UPDATED,
      CampaignEvent.RENAMED,
      CampaignEvent.SCHEDULED,
      CampaignEvent.SENDING_STARTED,
      CampaignEvent.PAUSED,
      CampaignEvent.RESUMED,
      CampaignEvent.CANCELED,
      CampaignEvent.COMPLETED,
      CampaignEvent.FAILED);

  private final CampaignReadModelStore store;
  private final EventCodec<CampaignEvent> codec;

  public CampaignProjection(CampaignReadModelStore store) {
    this(store, new JacksonCampaignEventCodec());
  }

  public CampaignProjection(CampaignReadModelStore store, EventCodec<CampaignEvent> codec) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Set<String> eventTypes() {
    return EVENT_TYPES;
  }

  @Override
  public void apply(StoredEvent stored) {
    CampaignEvent event = codec.decode(stored);
    if (event instanceof CampaignEvent.Unknown) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Skipping unknown event type " + stored.eventType() + " for " + stored.streamId());
      }
      return;
    }
    Optional<CampaignReadModel> existing = store.find(stored.streamId());
    if (existing.isPresent() && stored.version() <= existing.get().version()) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Ignoring already applied " + stored.eventType() + " v" + stored.version()
            + " for " + stored.streamId());
      }
      return;
    }
    CampaignReadModel updated;
    if (event instanceof CampaignEvent.Created created) {
      updated = created(stored, created);
    } else {
      CampaignReadModel current = existing.orElseThrow(() -> new IllegalStateException(
          "Campaign not found: " + stored.streamId() + " (" + stored.eventType() + " v" + stored.version() + ")"));
      updated = fold(current.toBuilder(), current, event).updatedAt(event.occurredAt()).version(stored.version()).build();
    }
    store.upsert(updated);
  }

  private static CampaignReadModel created(StoredEvent stored, CampaignEvent.Created created) {
    return withDetails(CampaignReadModel.builder(stored.streamId()), created.details())
        .status(CampaignStatus.DRAFT)
        .createdAt(created.occurredAt())
        .updatedAt(created.occurredAt())
        .version(stored.version())
        .build();
  }

  private static CampaignReadModel.Builder fold(CampaignReadModel.Builder next, CampaignReadModel current,
      CampaignEvent event) {
    if (event instanceof CampaignEvent.Updated updated) {
      return withDetails(next, updated.details());
    } else if (event instanceof CampaignEvent.Renamed renamed) {
      return next.name(renamed.name());
    } else if (event instanceof CampaignEvent.Scheduled scheduled) {
      return next.status(CampaignStatus.SCHEDULED).scheduledAt(scheduled.scheduledAt());
    } else if (event instanceof CampaignEvent.SendingStarted started) {
      return next.status(CampaignStatus.SENDING).sentAt(started.sentAt());
    } else if (event instanceof CampaignEvent.Paused) {
      return next.status(CampaignStatus.PAUSED);
    } else if (event instanceof CampaignEvent.Resumed) {
      return next.status(CampaignStatus.SENDING);
    } else if (event instanceof CampaignEvent.Canceled) {
      return next.status(CampaignStatus.CANCELED);
    } else if (event instanceof CampaignEvent.Completed completed) {
      return next.status(CampaignStatus.COMPLETED).completedAt(completed.occurredAt());
    } else if (event instanceof CampaignEvent.Failed failed) {
      Map<String, String> metadata = new LinkedHashMap<>(current.metadata());
      metadata.put("failureReason", failed.reason());
      metadata.put("failedAt", failed.occurredAt().toString());
      return next.status(CampaignStatus.FAILED).metadata(metadata);
    }
    throw new IllegalStateException("Unhandled campaign event " + event.getClass().getName());
  }

  private static CampaignReadModel.Builder withDetails(CampaignReadModel.Builder builder, CampaignDetails d) {
    return builder
        .name(d.name())
        .description(d.description())
        .subject(d.subject())
        .contentType(d.contentType())
        .fromName(d.fromName())
        .fromEmail(d.fromEmail())
        .replyToEmail(d.replyToEmail())
        .segmentId(d.segmentId())
        .templateId(d.templateId())
        .metadata(d.metadata());
  }

  @Override
  public void reset() {
    store.clear();
    logger.info("Cleared campaign read models for rebuild");
  }
}
