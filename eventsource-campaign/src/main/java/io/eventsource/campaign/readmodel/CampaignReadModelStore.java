package io.eventsource.campaign.readmodel;

import io.eventsource.campaign.CampaignStatus;

import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link CampaignReadModel}s. Written only by {@link CampaignProjection}.
 */
public interface CampaignReadModelStore {

  /**
   * Creates the backing schema if missing. Idempotent.
   */
  void initialize();

  Optional<CampaignReadModel> find(String campaignId);

  /**
   * Returns up to {@code limit} campaigns in a status, most recently updated first.
   */
  List<CampaignReadModel> findByStatus(CampaignStatus status, int limit);

  long countByStatus(CampaignStatus status);

  /**
   * Inserts or replaces the view of one campaign.
   */
  void upsert(CampaignReadModel model);

  /**
   * Deletes every view, ahead of a rebuild.
   */
  void clear();
}
