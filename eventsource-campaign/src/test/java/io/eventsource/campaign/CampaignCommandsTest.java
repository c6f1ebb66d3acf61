package io.eventsource.campaign;

import io.eventsource.AggregateNotFoundException;
import io.eventsource.ConcurrencyConflictException;
import io.eventsource.aggregate.AggregateRepository;
import io.eventsource.memory.InMemoryEventStore;
import io.eventsource.model.StoredEvent;
import io.eventsource.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.eventsource.campaign.CampaignFixtures.CLOCK;
import static io.eventsource.campaign.CampaignFixtures.NOW;
import static io.eventsource.campaign.CampaignFixtures.details;
import static org.junit.jupiter.api.Assertions.*;

class CampaignCommandsTest {
  private static final CampaignId ID = CampaignId.of("campaign-1");

  private final InMemoryEventStore eventStore = new InMemoryEventStore();
  private final CampaignCommands commands = new CampaignCommands(eventStore,
      MetricsExporter.NOOP, CLOCK, 3);

  @Test
  void createThenCommandsAdvanceTheStreamVersion() {
    Campaign created = commands.create(ID, details("Spring"));
    assertEquals(1, created.version());

    assertEquals(2, commands.rename(ID, "Spring Sale"));
    assertEquals(3, commands.schedule(ID, NOW.plus(Duration.ofHours(2))));
    assertEquals(4, commands.startSending(ID));

    Campaign loaded = commands.repository().load(ID);
    assertEquals("Spring Sale", loaded.name());
    assertEquals(CampaignStatus.SENDING, loaded.status());
    assertEquals(4, loaded.version());
  }

  @Test
  void creatingAnExistingCampaignConflicts() {
    commands.create(ID, details("Spring"));

    assertThrows(ConcurrencyConflictException.class, () -> commands.create(ID, details("Other")));
  }

  @Test
  void commandOnMissingCampaignIsNotFound() {
    assertThrows(AggregateNotFoundException.class, () -> commands.pause(CampaignId.of("campaign-404")));
  }

  @Test
  void invalidTransitionAppendsNothing() {
    commands.create(ID, details("Spring"));

    assertThrows(IllegalStateException.class, () -> commands.complete(ID));

    assertEquals(1, eventStore.currentVersion(ID.value()));
  }

  @Test
  void replayedCampaignEqualsTheOneThatProducedTheEvents() {
    Campaign original = Campaign.create(ID, details("Spring"), CLOCK);
    original.rename("Spring Sale");
    original.schedule(NOW.plus(Duration.ofDays(2)));
    original.startSending();
    original.pause();
    original.resume();
    original.fail("bounce storm");
    AggregateRepository<CampaignId, CampaignEvent, Campaign> repository = commands.repository();
    repository.save(original);

    Campaign replayed = repository.load(ID);

    assertEquals(original, replayed);
    assertEquals(original.version(), replayed.version());
    assertEquals(original.details(), replayed.details());
    assertEquals(original.status(), replayed.status());
    assertEquals(original.createdAt(), replayed.createdAt());
    assertEquals(original.updatedAt(), replayed.updatedAt());
    assertEquals(original.scheduledAt(), replayed.scheduledAt());
    assertEquals(original.sentAt(), replayed.sentAt());
    assertEquals(original.failureReason(), replayed.failureReason());
    assertFalse(replayed.hasPendingEvents());
  }

  @Test
  void staleCopyLosesAndMustReload() {
    commands.create(ID, details("Spring"));
    AggregateRepository<CampaignId, CampaignEvent, Campaign> repository = commands.repository();
    Campaign first = repository.load(ID);
    Campaign stale = repository.load(ID);

    first.rename("Spring Sale");
    repository.save(first);
    stale.rename("Spring Clearance");

    ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
        () -> repository.save(stale));
    assertEquals(1, e.expectedVersion());
    assertEquals(2, e.actualVersion());
    assertEquals(1, stale.version());
    assertEquals(1, stale.pendingEvents().size());

    assertEquals(List.of("campaign.created", "campaign.renamed"),
        eventStore.loadStream(ID.value()).stream().map(StoredEvent::eventType).toList());
    assertEquals("Spring Sale", repository.load(ID).name());
  }
}
