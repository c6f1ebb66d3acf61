package io.eventsource.campaign.readmodel;

import io.eventsource.campaign.CampaignStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Query-side view of one campaign, maintained by {@link CampaignProjection}.
 *
 * @param version stream version of the last event folded into this view
 */
public record CampaignReadModel(
    String id,
    String name,
    String description,
    String subject,
    String contentType,
    String fromName,
    String fromEmail,
    String replyToEmail,
    CampaignStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant scheduledAt,
    Instant sentAt,
    Instant completedAt,
    String segmentId,
    String templateId,
    Map<String, String> metadata,
    long version
) {
  public CampaignReadModel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public Builder toBuilder() {
    return new Builder(id)
        .name(name)
        .description(description)
        .subject(subject)
        .contentType(contentType)
        .fromName(fromName)
        .fromEmail(fromEmail)
        .replyToEmail(replyToEmail)
        .status(status)
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .scheduledAt(scheduledAt)
        .sentAt(sentAt)
        .completedAt(completedAt)
        .segmentId(segmentId)
        .templateId(templateId)
        .metadata(metadata)
        .version(version);
  }

  public static final class Builder {
    private final String id;
    private String name;
    private String description;
    private String subject;
    private String contentType;
    private String fromName;
    private String fromEmail;
    private String replyToEmail;
    private CampaignStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant scheduledAt;
    private Instant sentAt;
    private Instant completedAt;
    private String segmentId;
    private String templateId;
    private Map<String, String> metadata;
    private long version;

    private Builder(String id) {
      this.id = id;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder subject(String subject) {
      this.subject = subject;
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder fromName(String fromName) {
      this.fromName = fromName;
      return this;
    }

    public Builder fromEmail(String fromEmail) {
      this.fromEmail = fromEmail;
      return this;
    }

    public Builder replyToEmail(String replyToEmail) {
      this.replyToEmail = replyToEmail;
      return this;
    }

    public Builder status(CampaignStatus status) {
      this.status = status;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder scheduledAt(Instant scheduledAt) {
      this.scheduledAt = scheduledAt;
      return this;
    }

    public Builder sentAt(Instant sentAt) {
      this.sentAt = sentAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder segmentId(String segmentId) {
      this.segmentId = segmentId;
      return this;
    }

    public Builder templateId(String templateId) {
      this.templateId = templateId;
      return this;
    }

    public Builder metadata(Map<String, String> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public CampaignReadModel build() {
      return new CampaignReadModel(id, name, description, subject, contentType, fromName, fromEmail,
          replyToEmail, status, createdAt, updatedAt, scheduledAt, sentAt, completedAt, segmentId,
          templateId, metadata, version);
    }
  }
}
