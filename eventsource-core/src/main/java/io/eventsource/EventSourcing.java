package io.eventsource;

import io.eventsource.aggregate.AggregateFactory;
import io.eventsource.aggregate.AggregateRepository;
import io.eventsource.aggregate.AggregateRoot;
import io.eventsource.aggregate.EventCodec;
import io.eventsource.projection.PoisonEventManager;
import io.eventsource.projection.Projection;
import io.eventsource.projection.ProjectionManager;
import io.eventsource.projection.RetryPolicy;
import io.eventsource.spi.CheckpointStore;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;
import io.eventsource.spi.UnitOfWork;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Composition root wiring an {@link EventStore}, a {@link CheckpointStore} and a
 * {@link ProjectionManager} into one {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventSourcing es = EventSourcing.builder()
 *     .eventStore(eventStore)
 *     .checkpointStore(checkpointStore)
 *     .unitOfWork(new JdbcUnitOfWork(txManager))
 *     .projection(campaignProjection)
 *     .build()) {
 *   es.start();
 *   AggregateRepository<CampaignId, CampaignEvent, Campaign> campaigns =
 *       es.repository(codec, (CampaignId id) -> new Campaign(id, clock));
 *   // handle commands...
 * }
 * }</pre>
 *
 * @see ProjectionManager
 * @see AggregateRepository
 */
public final class EventSourcing implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventSourcing.class.getName());

  private final EventStore eventStore;
  private final CheckpointStore checkpointStore;
  private final MetricsExporter metrics;
  private final ProjectionManager projectionManager;
  private final PoisonEventManager poisonEvents;
  private final boolean initializeSchema;
  private final boolean startProjections;
  private final List<Runnable> initializers;

  private boolean started;
  private boolean closed;

  private EventSourcing(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.checkpointStore = Objects.requireNonNull(builder.checkpointStore, "checkpointStore");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.initializeSchema = builder.initializeSchema;
    this.startProjections = builder.startProjections;
    this.initializers = List.copyOf(builder.initializers);

    ProjectionManager.Builder pm = ProjectionManager.builder()
        .eventStore(eventStore)
        .checkpointStore(checkpointStore)
        .unitOfWork(builder.unitOfWork)
        .retryPolicy(builder.retryPolicy)
        .metrics(metrics)
        .projections(builder.projections);
    if (builder.maxAttempts != null) {
      pm.maxAttempts(builder.maxAttempts);
    }
    if (builder.batchSize != null) {
      pm.batchSize(builder.batchSize);
    }
    if (builder.intervalMs != null) {
      pm.intervalMs(builder.intervalMs);
    }
    this.projectionManager = pm.build();
    this.poisonEvents = new PoisonEventManager(projectionManager, checkpointStore);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the schema when enabled, then starts the projections when enabled.
   * Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("EventSourcing has been closed");
    }
    if (started) {
      return;
    }
    if (initializeSchema) {
      eventStore.initialize();
      checkpointStore.initialize();
      for (Runnable initializer : initializers) {
        initializer.run();
      }
    }
    if (startProjections) {
      projectionManager.start();
    }
    started = true;
    logger.info("Event sourcing started with projections " + projectionManager.projectionNames());
  }

  /**
   * Creates a repository for one aggregate type over this instance's store and metrics.
   */
  public <ID extends Identifier, E extends DomainEvent, A extends AggregateRoot<ID, E>>
      AggregateRepository<ID, E, A> repository(EventCodec<E> codec, AggregateFactory<ID, E, A> factory) {
    return new AggregateRepository<>(eventStore, codec, factory, metrics);
  }

  public EventStore eventStore() {
    return eventStore;
  }

  public CheckpointStore checkpointStore() {
    return checkpointStore;
  }

  public ProjectionManager projectionManager() {
    return projectionManager;
  }

  public PoisonEventManager poisonEvents() {
    return poisonEvents;
  }

  /**
   * Stops the projections and closes the metrics exporter if it is closeable.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    try {
      projectionManager.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r)
            ? r : new EventSourcingException("Failed to close metrics", e);
        if (first == null) {
          first = re;
        } else {
          first.addSuppressed(re);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link EventSourcing}. Projection settings left unset fall back to the
   * {@link ProjectionManager.Builder} defaults.
   */
  public static final class Builder {
    private EventStore eventStore;
    private CheckpointStore checkpointStore;
    private UnitOfWork unitOfWork;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private Integer maxAttempts;
    private Integer batchSize;
    private Long intervalMs;
    private boolean initializeSchema = true;
    private boolean startProjections = true;
    private final List<Projection> projections = new ArrayList<>();
    private final List<Runnable> initializers = new ArrayList<>();

    private Builder() {
    }

    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    public Builder checkpointStore(CheckpointStore checkpointStore) {
      this.checkpointStore = checkpointStore;
      return this;
    }

    public Builder unitOfWork(UnitOfWork unitOfWork) {
      this.unitOfWork = unitOfWork;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Whether {@link #start()} creates missing tables. Defaults to {@code true}.
     */
    public Builder initializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
      return this;
    }

    /**
     * Whether {@link #start()} starts the projection runners. Defaults to {@code true};
     * disable to drive projections through {@link ProjectionManager#pollNow}.
     */
    public Builder startProjections(boolean startProjections) {
      this.startProjections = startProjections;
      return this;
    }

    public Builder projection(Projection projection) {
      this.projections.add(Objects.requireNonNull(projection, "projection"));
      return this;
    }

    public Builder projections(Iterable<? extends Projection> projections) {
      for (Projection projection : projections) {
        projection(projection);
      }
      return this;
    }

    /**
     * Extra schema step run by {@link #start()} after the stores are initialized, such as
     * creating a read-model table.
     */
    public Builder initializer(Runnable initializer) {
      this.initializers.add(Objects.requireNonNull(initializer, "initializer"));
      return this;
    }

    public EventSourcing build() {
      return new EventSourcing(this);
    }
  }
}
