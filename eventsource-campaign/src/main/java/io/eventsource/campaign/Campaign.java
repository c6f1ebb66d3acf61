package io.eventsource.campaign;

import io.eventsource.aggregate.AggregateRoot;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Event-sourced email campaign.
 *
 * <pre>
 * DRAFT --schedule--> SCHEDULED --startSending--> SENDING --complete--> COMPLETED
 *   |                                               |  ^
 *   +-----------------startSending------------------+  |
 *                                                 pause resume
 *                                                   v  |
 *                                                  PAUSED
 * </pre>
 * Only a draft can be updated. Any state but COMPLETED and CANCELED can be canceled, so a
 * FAILED campaign can still be closed out as canceled. Any non-terminal state can fail.
 * Commands that are not allowed in the current state throw {@link IllegalStateException}
 * and record nothing.
 */
public final class Campaign extends AggregateRoot<CampaignId, CampaignEvent> {
  private final Clock clock;

  private CampaignDetails details;
  private CampaignStatus status;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant scheduledAt;
  private Instant sentAt;
  private Instant completedAt;
  private String failureReason;

  public Campaign(CampaignId id) {
    this(id, Clock.systemUTC());
  }

  public Campaign(CampaignId id, Clock clock) {
    super(id);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static Campaign create(CampaignId id, CampaignDetails details) {
    return create(id, details, Clock.systemUTC());
  }

  /**
   * Starts a new campaign in {@link CampaignStatus#DRAFT}.
   */
  public static Campaign create(CampaignId id, CampaignDetails details, Clock clock) {
    Objects.requireNonNull(details, "details");
    Campaign campaign = new Campaign(id, clock);
    campaign.emit(new CampaignEvent.Created(id.value(), details, clock.instant()));
    return campaign;
  }

  /**
   * Edits a draft campaign's content. Optional fields left {@code null} keep their
   * current values and metadata is merged into the existing attributes.
   */
  public void update(CampaignChanges changes) {
    Objects.requireNonNull(changes, "changes");
    requireStatus(CampaignStatus.DRAFT, "update");
    emit(new CampaignEvent.Updated(id().value(), changes.applyTo(details), clock.instant()));
  }

  public void rename(String newName) {
    CampaignDetails.requireName(newName);
    requireCreated();
    if (status.isTerminal()) {
      throw new IllegalStateException("Cannot rename " + describe());
    }
    if (!newName.equals(details.name())) {
      emit(new CampaignEvent.Renamed(id().value(), newName, clock.instant()));
    }
  }

  public void schedule(Instant at) {
    Objects.requireNonNull(at, "scheduledAt");
    requireCreated();
    if (status != CampaignStatus.DRAFT) {
      throw new IllegalStateException("Cannot schedule " + describe());
    }
    Instant now = clock.instant();
    if (!at.isAfter(now)) {
      throw new IllegalArgumentException("Scheduled date must be in the future: " + at);
    }
    emit(new CampaignEvent.Scheduled(id().value(), at, now));
  }

  public void startSending() {
    requireCreated();
    if (status != CampaignStatus.DRAFT && status != CampaignStatus.SCHEDULED) {
      throw new IllegalStateException("Cannot start sending " + describe());
    }
    if (details.segmentId() == null) {
      throw new IllegalStateException("Campaign " + id().value() + " must have a segment to be sent");
    }
    Instant now = clock.instant();
    emit(new CampaignEvent.SendingStarted(id().value(), sentAt != null ? sentAt : now, now));
  }

  public void pause() {
    requireStatus(CampaignStatus.SENDING, "pause");
    emit(new CampaignEvent.Paused(id().value(), clock.instant()));
  }

  public void resume() {
    requireStatus(CampaignStatus.PAUSED, "resume");
    emit(new CampaignEvent.Resumed(id().value(), clock.instant()));
  }

  public void cancel() {
    requireCreated();
    if (status == CampaignStatus.COMPLETED || status == CampaignStatus.CANCELED) {
      throw new IllegalStateException("Cannot cancel " + describe());
    }
    emit(new CampaignEvent.Canceled(id().value(), clock.instant()));
  }

  public void complete() {
    requireStatus(CampaignStatus.SENDING, "complete");
    emit(new CampaignEvent.Completed(id().value(), clock.instant()));
  }

  public void fail(String reason) {
    Objects.requireNonNull(reason, "reason");
    requireCreated();
    if (status.isTerminal()) {
      throw new IllegalStateException("Cannot mark a terminal campaign as failed, " + describe());
    }
    emit(new CampaignEvent.Failed(id().value(), reason, clock.instant()));
  }

  @Override
  protected void apply(CampaignEvent event) {
    if (event instanceof CampaignEvent.Created created) {
      details = created.details();
      status = CampaignStatus.DRAFT;
      createdAt = created.occurredAt();
    } else if (event instanceof CampaignEvent.Updated updated) {
      details = updated.details();
    } else if (event instanceof CampaignEvent.Renamed renamed) {
      details = details.withName(renamed.name());
    } else if (event instanceof CampaignEvent.Scheduled scheduled) {
      status = CampaignStatus.SCHEDULED;
      scheduledAt = scheduled.scheduledAt();
    } else if (event instanceof CampaignEvent.SendingStarted started) {
      status = CampaignStatus.SENDING;
      sentAt = started.sentAt();
    } else if (event instanceof CampaignEvent.Paused) {
      status = CampaignStatus.PAUSED;
    } else if (event instanceof CampaignEvent.Resumed) {
      status = CampaignStatus.SENDING;
    } else if (event instanceof CampaignEvent.Canceled) {
      status = CampaignStatus.CANCELED;
    } else if (event instanceof CampaignEvent.Completed completed) {
      status = CampaignStatus.COMPLETED;
      completedAt = completed.occurredAt();
    } else if (event instanceof CampaignEvent.Failed failed) {
      status = CampaignStatus.FAILED;
      failureReason = failed.reason();
    } else if (event instanceof CampaignEvent.Unknown) {
      // written by a newer release, nothing to fold
      return;
    } else {
      throw new IllegalStateException("Unhandled campaign event " + event.getClass().getName());
    }
    updatedAt = event.occurredAt();
  }

  private void requireCreated() {
    if (status == null) {
      throw new IllegalStateException("Campaign " + id().value() + " has not been created");
    }
  }

  private void requireStatus(CampaignStatus required, String action) {
    requireCreated();
    if (status != required) {
      throw new IllegalStateException("Cannot " + action + " " + describe());
    }
  }

  private String describe() {
    return "campaign " + id().value() + " in status " + status;
  }

  public CampaignDetails details() {
    return details;
  }

  public String name() {
    return details == null ? null : details.name();
  }

  public CampaignStatus status() {
    return status;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public Instant scheduledAt() {
    return scheduledAt;
  }

  public Instant sentAt() {
    return sentAt;
  }

  public Instant completedAt() {
    return completedAt;
  }

  public String failureReason() {
    return failureReason;
  }
}
