package io.eventsource.campaign.readmodel;

import io.eventsource.campaign.CampaignStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Map-backed read-model store for tests and single-process use with the in-memory
 * event store.
 */
public final class InMemoryCampaignReadModelStore implements CampaignReadModelStore {
  private final ConcurrentMap<String, CampaignReadModel> models = new ConcurrentHashMap<>();

  @Override
  public void initialize() {
  }

  @Override
  public Optional<CampaignReadModel> find(String campaignId) {
    return Optional.ofNullable(models.get(campaignId));
  }

  @Override
  public List<CampaignReadModel> findByStatus(CampaignStatus status, int limit) {
    Objects.requireNonNull(status, "status");
    return models.values().stream()
        .filter(m -> m.status() == status)
        .sorted(Comparator.comparing(CampaignReadModel::updatedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
        .limit(limit)
        .toList();
  }

  @Override
  public long countByStatus(CampaignStatus status) {
    return models.values().stream().filter(m -> m.status() == status).count();
  }

  @Override
  public void upsert(CampaignReadModel model) {
    models.put(model.id(), model);
  }

  @Override
  public void clear() {
    models.clear();
  }
}
