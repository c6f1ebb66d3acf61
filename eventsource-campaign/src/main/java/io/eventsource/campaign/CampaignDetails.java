package io.eventsource.campaign;

import io.eventsource.Identifier;

import java.util.Map;
import java.util.Objects;

/**
 * Editable content and addressing of a campaign, carried by
 * {@link CampaignEvent.Created} and {@link CampaignEvent.Updated}.
 *
 * <p>Length limits match the read model columns, so a campaign that can be created can
 * always be projected. Description and metadata are unbounded.
 *
 * @param name         display name, not blank, at most {@value #MAX_NAME_LENGTH} characters
 * @param description  free text, may be empty
 * @param subject      email subject line, not blank, at most {@value #MAX_SUBJECT_LENGTH} characters
 * @param contentType  {@code "html"} or {@code "text"}
 * @param fromName     sender display name, at most {@value #MAX_NAME_LENGTH} characters
 * @param fromEmail    sender address, at most {@value #MAX_EMAIL_LENGTH} characters
 * @param replyToEmail reply-to address, or {@code null}
 * @param segmentId    audience segment, or {@code null} until one is chosen
 * @param templateId   template, or {@code null}
 * @param metadata     free-form string attributes
 */
public record CampaignDetails(
    String name,
    String description,
    String subject,
    String contentType,
    String fromName,
    String fromEmail,
    String replyToEmail,
    String segmentId,
    String templateId,
    Map<String, String> metadata
) {
  public static final String HTML = "html";
  public static final String TEXT = "text";

  public static final int MAX_NAME_LENGTH = 255;
  public static final int MAX_SUBJECT_LENGTH = 998;
  public static final int MAX_EMAIL_LENGTH = 320;
  public static final int MAX_REFERENCE_LENGTH = Identifier.MAX_LENGTH;

  public CampaignDetails {
    requireName(name);
    requireText(subject, "subject", MAX_SUBJECT_LENGTH);
    requireText(fromName, "fromName", MAX_NAME_LENGTH);
    requireText(fromEmail, "fromEmail", MAX_EMAIL_LENGTH);
    requireMaxLength(replyToEmail, "replyToEmail", MAX_EMAIL_LENGTH);
    requireMaxLength(segmentId, "segmentId", MAX_REFERENCE_LENGTH);
    requireMaxLength(templateId, "templateId", MAX_REFERENCE_LENGTH);
    description = description == null ? "" : description;
    contentType = contentType == null ? HTML : contentType;
    if (!HTML.equals(contentType) && !TEXT.equals(contentType)) {
      throw new IllegalArgumentException("contentType must be 'html' or 'text': " + contentType);
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Returns a copy with another name.
   */
  public CampaignDetails withName(String newName) {
    return new CampaignDetails(newName, description, subject, contentType, fromName, fromEmail,
        replyToEmail, segmentId, templateId, metadata);
  }

  /**
   * Returns a copy with another metadata map.
   */
  public CampaignDetails withMetadata(Map<String, String> newMetadata) {
    return new CampaignDetails(name, description, subject, contentType, fromName, fromEmail,
        replyToEmail, segmentId, templateId, newMetadata);
  }

  /**
   * Validates a campaign name.
   *
   * @throws NullPointerException     if name is null
   * @throws IllegalArgumentException if name is blank or longer than {@value #MAX_NAME_LENGTH}
   */
  public static String requireName(String name) {
    return requireText(name, "name", MAX_NAME_LENGTH);
  }

  private static String requireText(String value, String field, int maxLength) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " cannot be blank");
    }
    return requireMaxLength(value, field, maxLength);
  }

  private static String requireMaxLength(String value, String field, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new IllegalArgumentException(field + " exceeds " + maxLength + " characters");
    }
    return value;
  }
}
