package io.eventsource.campaign;

/**
 * Lifecycle states of a campaign.
 */
public enum CampaignStatus {
  DRAFT,
  SCHEDULED,
  SENDING,
  PAUSED,
  COMPLETED,
  CANCELED,
  FAILED;

  /**
   * Returns {@code true} once sending is over. A terminal campaign can no longer be
   * renamed or failed; the one transition left is canceling a {@link #FAILED} campaign.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELED || this == FAILED;
  }
}
