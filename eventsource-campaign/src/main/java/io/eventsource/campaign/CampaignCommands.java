package io.eventsource.campaign;

import io.eventsource.aggregate.AggregateRepository;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Command side of the campaign service.
 *
 * <p>Each command loads the campaign, runs the transition and saves it. On a concurrency
 * conflict the command is re-run against freshly loaded state, up to
 * {@code maxAttempts} times; a transition that is no longer valid after the reload fails
 * with {@link IllegalStateException}.
 */
public final class CampaignCommands {
  private static final Logger logger = Logger.getLogger(CampaignCommands.class.getName());

  private final AggregateRepository<CampaignId, CampaignEvent, Campaign> repository;
  private final Clock clock;
  private final int maxAttempts;

  public CampaignCommands(EventStore eventStore) {
    this(eventStore, MetricsExporter.NOOP, Clock.systemUTC(), 3);
  }

  public CampaignCommands(EventStore eventStore, MetricsExporter metrics, Clock clock, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxAttempts = maxAttempts;
    this.repository = new AggregateRepository<CampaignId, CampaignEvent, Campaign>(eventStore,
        new JacksonCampaignEventCodec(), id -> new Campaign(id, clock), metrics);
  }

  public AggregateRepository<CampaignId, CampaignEvent, Campaign> repository() {
    return repository;
  }

  /**
   * Creates a campaign.
   *
   * @throws io.eventsource.ConcurrencyConflictException if the id is already taken
   */
  public Campaign create(CampaignId id, CampaignDetails details) {
    Campaign campaign = Campaign.create(id, details, clock);
    repository.save(campaign);
    logger.info("Created campaign " + id.value());
    return campaign;
  }

  public long update(CampaignId id, CampaignChanges changes) {
    return run(id, c -> c.update(changes));
  }

  public long rename(CampaignId id, String name) {
    return run(id, c -> c.rename(name));
  }

  public long schedule(CampaignId id, Instant scheduledAt) {
    return run(id, c -> c.schedule(scheduledAt));
  }

  public long startSending(CampaignId id) {
    return run(id, Campaign::startSending);
  }

  public long pause(CampaignId id) {
    return run(id, Campaign::pause);
  }

  public long resume(CampaignId id) {
    return run(id, Campaign::resume);
  }

  public long cancel(CampaignId id) {
    return run(id, Campaign::cancel);
  }

  public long complete(CampaignId id) {
    return run(id, Campaign::complete);
  }

  public long fail(CampaignId id, String reason) {
    return run(id, c -> c.fail(reason));
  }

  /**
   * @return the campaign's stream version after the command
   */
  private long run(CampaignId id, Consumer<Campaign> command) {
    return repository.update(id, campaign -> {
      command.accept(campaign);
      return campaign;
    }, maxAttempts).version();
  }
}
