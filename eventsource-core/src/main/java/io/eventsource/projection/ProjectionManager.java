package io.eventsource.projection;

import io.eventsource.spi.CheckpointStore;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;
import io.eventsource.spi.UnitOfWork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a set of {@link Projection}s against the global event log.
 *
 * <p>Every projection gets its own runner with its own checkpoint, scheduler thread and
 * failure state, so a poison event in one projection never holds up another.
 *
 * <pre>{@code
 * ProjectionManager manager = ProjectionManager.builder()
 *     .eventStore(eventStore)
 *     .checkpointStore(checkpointStore)
 *     .unitOfWork(unitOfWork)
 *     .projection(new CampaignProjection(readModelStore))
 *     .build();
 * manager.start();
 * }</pre>
 *
 * <p>This class is thread-safe. {@link #start()} and {@link #close()} are synchronized.
 *
 * @see ProjectionManager.Builder
 * @see PoisonEventManager
 */
public final class ProjectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ProjectionManager.class.getName());

  private final Map<String, ProjectionRunner> runners;
  private volatile boolean closed;

  private ProjectionManager(Builder builder) {
    Objects.requireNonNull(builder.eventStore, "eventStore");
    Objects.requireNonNull(builder.checkpointStore, "checkpointStore");
    if (builder.unitOfWork == null) {
      builder.unitOfWork = UnitOfWork.DIRECT;
    }
    if (builder.retryPolicy == null) {
      builder.retryPolicy = new ExponentialBackoffRetryPolicy(200L, 60_000L);
    }
    if (builder.metrics == null) {
      builder.metrics = MetricsExporter.NOOP;
    }
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    Map<String, ProjectionRunner> byName = new LinkedHashMap<>();
    for (Projection projection : builder.projections) {
      ProjectionRunner runner = new ProjectionRunner(projection, builder);
      if (byName.putIfAbsent(runner.name(), runner) != null) {
        throw new IllegalArgumentException("Duplicate projection name: " + runner.name());
      }
    }
    this.runners = Collections.unmodifiableMap(byName);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts every registered projection. Subsequent calls are no-ops for projections
   * that are already running.
   */
  public synchronized void start() {
    ensureOpen();
    for (ProjectionRunner runner : runners.values()) {
      runner.start();
    }
    logger.info("Started " + runners.size() + " projection(s)");
  }

  /**
   * Starts a single projection.
   */
  public synchronized void start(String projectionName) {
    ensureOpen();
    runner(projectionName).start();
  }

  /**
   * Runs one poll cycle of a projection on the calling thread.
   */
  public void pollNow(String projectionName) {
    runner(projectionName).poll();
  }

  /**
   * Runs one poll cycle of every projection on the calling thread, in registration order.
   */
  public void pollAll() {
    for (ProjectionRunner runner : runners.values()) {
      runner.poll();
    }
  }

  /**
   * Clears a projection's read model and checkpoint and replays the whole log into it.
   * A running projection continues from sequence zero on its next poll; a stopped one
   * catches up when started or polled.
   */
  public void rebuild(String projectionName) {
    ensureOpen();
    runner(projectionName).rebuild();
  }

  public ProjectionStatus status(String projectionName) {
    return runner(projectionName).status();
  }

  public List<ProjectionStatus> statuses() {
    List<ProjectionStatus> result = new ArrayList<>(runners.size());
    for (ProjectionRunner runner : runners.values()) {
      result.add(runner.status());
    }
    return result;
  }

  public List<String> projectionNames() {
    return List.copyOf(runners.keySet());
  }

  boolean release(String projectionName) {
    return runner(projectionName).release();
  }

  boolean skip(String projectionName) {
    return runner(projectionName).skip();
  }

  private ProjectionRunner runner(String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    ProjectionRunner runner = runners.get(projectionName);
    if (runner == null) {
      throw new IllegalArgumentException("Unknown projection: " + projectionName);
    }
    return runner;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("ProjectionManager has been closed");
    }
  }

  /**
   * Stops every runner. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (ProjectionRunner runner : runners.values()) {
      try {
        runner.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to stop projection " + runner.name(), e);
      }
    }
  }

  /**
   * Builder for {@link ProjectionManager}.
   *
   * <p>Required: {@link #eventStore} and {@link #checkpointStore}. Defaults: direct unit of
   * work, exponential backoff from 200 ms to 60 s, 5 attempts, batches of 100, 1 s poll
   * interval, no metrics.
   */
  public static final class Builder {
    EventStore eventStore;
    CheckpointStore checkpointStore;
    UnitOfWork unitOfWork;
    RetryPolicy retryPolicy;
    int maxAttempts = 5;
    int batchSize = 100;
    long intervalMs = 1000L;
    MetricsExporter metrics;
    private final List<Projection> projections = new ArrayList<>();

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

    /**
     * Unit of work that makes the read-model write and the checkpoint write atomic. Use
     * {@code JdbcUnitOfWork} when both live in the same database.
     */
    public Builder unitOfWork(UnitOfWork unitOfWork) {
      this.unitOfWork = unitOfWork;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Total apply attempts for one event before it is treated as poison.
     */
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

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
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

    public ProjectionManager build() {
      return new ProjectionManager(this);
    }
  }
}
