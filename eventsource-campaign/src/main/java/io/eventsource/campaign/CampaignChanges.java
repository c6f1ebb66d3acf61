package io.eventsource.campaign;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Content edit of a draft campaign.
 *
 * <p>Name, subject and sender are always replaced. The other fields are optional: a
 * {@code null} keeps the campaign's current value. Metadata is merged into the existing
 * attributes.
 */
public record CampaignChanges(
    String name,
    String subject,
    String fromName,
    String fromEmail,
    String description,
    String contentType,
    String replyToEmail,
    String segmentId,
    String templateId,
    Map<String, String> metadata
) {

  public CampaignChanges {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(fromName, "fromName");
    Objects.requireNonNull(fromEmail, "fromEmail");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Changes only the required fields.
   */
  public static CampaignChanges of(String name, String subject, String fromName, String fromEmail) {
    return new CampaignChanges(name, subject, fromName, fromEmail, null, null, null, null, null, null);
  }

  public CampaignChanges withDescription(String newDescription) {
    return new CampaignChanges(name, subject, fromName, fromEmail, newDescription, contentType,
        replyToEmail, segmentId, templateId, metadata);
  }

  public CampaignChanges withSegmentId(String newSegmentId) {
    return new CampaignChanges(name, subject, fromName, fromEmail, description, contentType,
        replyToEmail, newSegmentId, templateId, metadata);
  }

  public CampaignChanges withMetadata(Map<String, String> newMetadata) {
    return new CampaignChanges(name, subject, fromName, fromEmail, description, contentType,
        replyToEmail, segmentId, templateId, newMetadata);
  }

  /**
   * Applies the changes to the current details.
   *
   * @throws IllegalArgumentException if the result is not valid campaign details
   */
  public CampaignDetails applyTo(CampaignDetails current) {
    Map<String, String> merged = new LinkedHashMap<>(current.metadata());
    merged.putAll(metadata);
    return new CampaignDetails(
        name,
        description != null ? description : current.description(),
        subject,
        contentType != null ? contentType : current.contentType(),
        fromName,
        fromEmail,
        replyToEmail != null ? replyToEmail : current.replyToEmail(),
        segmentId != null ? segmentId : current.segmentId(),
        templateId != null ? templateId : current.templateId(),
        merged);
  }
}
