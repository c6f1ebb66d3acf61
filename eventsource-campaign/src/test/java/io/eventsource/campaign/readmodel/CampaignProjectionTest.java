package io.eventsource.campaign.readmodel;

import io.eventsource.campaign.CampaignChanges;
import io.eventsource.campaign.CampaignCommands;
import io.eventsource.campaign.CampaignEvent;
import io.eventsource.campaign.CampaignId;
import io.eventsource.campaign.CampaignStatus;
import io.eventsource.memory.InMemoryCheckpointStore;
import io.eventsource.memory.InMemoryEventStore;
import io.eventsource.model.ProjectionState;
import io.eventsource.model.StoredEvent;
import io.eventsource.projection.ProjectionManager;
import io.eventsource.spi.MetricsExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.eventsource.campaign.CampaignFixtures.CLOCK;
import static io.eventsource.campaign.CampaignFixtures.NOW;
import static io.eventsource.campaign.CampaignFixtures.details;
import static io.eventsource.campaign.CampaignFixtures.detailsWithoutSegment;
import static org.junit.jupiter.api.Assertions.*;

class CampaignProjectionTest {
  private static final CampaignId ID = CampaignId.of("campaign-1");

  private final InMemoryEventStore eventStore = new InMemoryEventStore();
  private final InMemoryCampaignReadModelStore readModels = new InMemoryCampaignReadModelStore();
  private final CampaignProjection projection = new CampaignProjection(readModels);
  private final CampaignCommands commands = new CampaignCommands(eventStore, MetricsExporter.NOOP, CLOCK, 3);
  private final ProjectionManager manager = ProjectionManager.builder()
      .eventStore(eventStore)
      .checkpointStore(new InMemoryCheckpointStore())
      .projection(projection)
      .build();

  @AfterEach
  void tearDown() {
    manager.close();
  }

  @Test
  void createdEventBuildsADraftView() {
    commands.create(ID, details("Spring"));

    manager.pollNow(CampaignProjection.NAME);

    CampaignReadModel view = readModels.find(ID.value()).orElseThrow();
    assertEquals("Spring", view.name());
    assertEquals("Our Spring offers", view.subject());
    assertEquals("html", view.contentType());
    assertEquals(CampaignStatus.DRAFT, view.status());
    assertEquals("segment-42", view.segmentId());
    assertEquals(NOW, view.createdAt());
    assertEquals(1, view.version());
    assertEquals(ProjectionState.LIVE, manager.status(CampaignProjection.NAME).state());
  }

  @Test
  void lifecycleEventsUpdateStatusAndTimestamps() {
    commands.create(ID, details("Spring"));
    commands.rename(ID, "Spring Sale");
    commands.schedule(ID, NOW.plus(Duration.ofDays(1)));
    commands.startSending(ID);
    commands.pause(ID);
    commands.resume(ID);
    commands.complete(ID);

    manager.pollNow(CampaignProjection.NAME);

    CampaignReadModel view = readModels.find(ID.value()).orElseThrow();
    assertEquals("Spring Sale", view.name());
    assertEquals(CampaignStatus.COMPLETED, view.status());
    assertEquals(NOW.plus(Duration.ofDays(1)), view.scheduledAt());
    assertEquals(NOW, view.sentAt());
    assertEquals(NOW, view.completedAt());
    assertEquals(7, view.version());
  }

  @Test
  void failureReasonLandsInMetadata() {
    commands.create(ID, details("Spring"));
    commands.fail(ID, "template rendering failed");

    manager.pollNow(CampaignProjection.NAME);

    CampaignReadModel view = readModels.find(ID.value()).orElseThrow();
    assertEquals(CampaignStatus.FAILED, view.status());
    assertEquals("template rendering failed", view.metadata().get("failureReason"));
    assertEquals(NOW.toString(), view.metadata().get("failedAt"));
    assertEquals("email", view.metadata().get("channel"));
  }

  @Test
  void applyingTheSameEventTwiceIsHarmless() throws Exception {
    commands.create(ID, details("Spring"));
    commands.rename(ID, "Spring Sale");
    List<StoredEvent> events = eventStore.readAll(1);
    for (StoredEvent event : events) {
      projection.apply(event);
    }
    CampaignReadModel once = readModels.find(ID.value()).orElseThrow();

    projection.apply(events.get(0));
    projection.apply(events.get(1));

    assertEquals(once, readModels.find(ID.value()).orElseThrow());
    assertEquals("Spring Sale", once.name());
  }

  @Test
  void eventForUnknownCampaignFails() {
    StoredEvent paused = new StoredEvent("01HZX0000000000000000000AB", "campaign-9", 2, 5,
        CampaignEvent.PAUSED, "{\"campaignId\":\"campaign-9\",\"occurredAt\":\"2026-04-01T09:00:00Z\"}",
        Map.of(), NOW, NOW);

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> projection.apply(paused));
    assertTrue(e.getMessage().contains("campaign-9"));
    assertTrue(readModels.find("campaign-9").isEmpty());
  }

  @Test
  void eventOfUnknownTypeLeavesTheViewUnchanged() {
    commands.create(ID, details("Spring"));
    manager.pollNow(CampaignProjection.NAME);
    CampaignReadModel before = readModels.find(ID.value()).orElseThrow();
    StoredEvent archived = new StoredEvent("01HZX0000000000000000000AC", ID.value(), 2, 9,
        "campaign.archived", "{\"campaignId\":\"campaign-1\",\"occurredAt\":\"2026-04-02T09:00:00Z\"}",
        Map.of(), NOW, NOW);

    projection.apply(archived);

    assertEquals(before, readModels.find(ID.value()).orElseThrow());
  }

  @Test
  void rebuildReproducesTheSameViews() {
    commands.create(ID, details("Spring"));
    commands.update(ID, CampaignChanges.of("Spring", "Our Spring offers", "Marketing", "news@example.com")
        .withMetadata(Map.of("tier", "gold")));
    commands.create(CampaignId.of("campaign-2"), detailsWithoutSegment("Autumn"));
    commands.cancel(CampaignId.of("campaign-2"));
    manager.pollNow(CampaignProjection.NAME);
    CampaignReadModel first = readModels.find(ID.value()).orElseThrow();
    CampaignReadModel second = readModels.find("campaign-2").orElseThrow();

    manager.rebuild(CampaignProjection.NAME);
    assertTrue(readModels.find(ID.value()).isEmpty());
    manager.pollNow(CampaignProjection.NAME);

    assertEquals(first, readModels.find(ID.value()).orElseThrow());
    assertEquals(second, readModels.find("campaign-2").orElseThrow());
    assertEquals(1, readModels.countByStatus(CampaignStatus.CANCELED));
    assertEquals(List.of(first), readModels.findByStatus(CampaignStatus.DRAFT, 10));
  }
}
