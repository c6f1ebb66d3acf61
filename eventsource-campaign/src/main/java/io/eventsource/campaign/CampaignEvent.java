package io.eventsource.campaign;

import io.eventsource.DomainEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything that can happen to a campaign. The hierarchy is closed: each record is one
 * stored event type, and {@link Unknown} stands in for types written by a newer version
 * of the service.
 */
public sealed interface CampaignEvent extends DomainEvent permits
    CampaignEvent.Created, CampaignEvent.Updated, CampaignEvent.Renamed, CampaignEvent.Scheduled,
    CampaignEvent.SendingStarted, CampaignEvent.Paused, CampaignEvent.Resumed,
    CampaignEvent.Canceled, CampaignEvent.Completed, CampaignEvent.Failed, CampaignEvent.Unknown {

  String CREATED = "campaign.created";
  String UPDATED = "campaign.updated";
  String RENAMED = "campaign.renamed";
  String SCHEDULED = "campaign.scheduled";
  String SENDING_STARTED = "campaign.sending.started";
  String PAUSED = "campaign.paused";
  String RESUMED = "campaign.resumed";
  String CANCELED = "campaign.canceled";
  String COMPLETED = "campaign.completed";
  String FAILED = "campaign.failed";

  String campaignId();

  Instant occurredAt();

  record Created(String campaignId, CampaignDetails details, Instant occurredAt) implements CampaignEvent {
    public Created {
      Objects.requireNonNull(details, "details");
    }

    @Override
    public String eventType() {
      return CREATED;
    }
  }

  record Updated(String campaignId, CampaignDetails details, Instant occurredAt) implements CampaignEvent {
    public Updated {
      Objects.requireNonNull(details, "details");
    }

    @Override
    public String eventType() {
      return UPDATED;
    }
  }

  record Renamed(String campaignId, String name, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return RENAMED;
    }
  }

  record Scheduled(String campaignId, Instant scheduledAt, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return SCHEDULED;
    }
  }

  /**
   * @param sentAt when sending first started; kept across pause and resume
   */
  record SendingStarted(String campaignId, Instant sentAt, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return SENDING_STARTED;
    }
  }

  record Paused(String campaignId, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return PAUSED;
    }
  }

  record Resumed(String campaignId, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return RESUMED;
    }
  }

  record Canceled(String campaignId, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return CANCELED;
    }
  }

  record Completed(String campaignId, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return COMPLETED;
    }
  }

  record Failed(String campaignId, String reason, Instant occurredAt) implements CampaignEvent {
    @Override
    public String eventType() {
      return FAILED;
    }
  }

  /**
   * An event type this version does not know. Aggregates ignore it; it is never emitted.
   *
   * @param payload the raw stored payload
   */
  record Unknown(String campaignId, String eventType, String payload, Instant occurredAt)
      implements CampaignEvent {
  }
}
