package io.eventsource.campaign;

import com.github.f4b6a3.ulid.UlidCreator;
import io.eventsource.Identifier;

/**
 * Campaign identifier; also the id of the campaign's event stream.
 */
public record CampaignId(String value) implements Identifier {

  public CampaignId {
    Identifier.requireValid(value);
  }

  public static CampaignId of(String value) {
    return new CampaignId(value);
  }

  /**
   * Returns a new identifier of the form {@code campaign-<ULID>}.
   */
  public static CampaignId generate() {
    return new CampaignId("campaign-" + UlidCreator.getMonotonicUlid().toString().toLowerCase());
  }

  @Override
  public String toString() {
    return value;
  }
}
