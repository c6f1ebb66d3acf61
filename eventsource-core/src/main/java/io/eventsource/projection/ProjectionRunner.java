package io.eventsource.projection;

import io.eventsource.EventSerializationException;
import io.eventsource.EventSourcingException;
import io.eventsource.ProjectionApplyException;
import io.eventsource.StoreUnavailableException;
import io.eventsource.model.ProjectionCheckpoint;
import io.eventsource.model.ProjectionState;
import io.eventsource.model.StoredEvent;
import io.eventsource.spi.CheckpointStore;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;
import io.eventsource.spi.UnitOfWork;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds one {@link Projection} from the global event log on its own scheduler thread.
 *
 * <p>Each poll reads the next page after the checkpoint and applies the events in
 * global-sequence order. Every event is applied and checkpointed in one
 * {@link UnitOfWork}. A failing event is retried on later polls with
 * {@link RetryPolicy} backoff; once {@code maxAttempts} is exhausted, or immediately for
 * an {@link EventSerializationException}, the event is recorded as poison and the runner
 * stops at it ({@link ProjectionState#STALLED}) until an operator releases or skips it.
 *
 * <p>Runners are created by {@link ProjectionManager}. Polls are serialized; lifecycle
 * methods are synchronized.
 */
final class ProjectionRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ProjectionRunner.class.getName());

  private final Projection projection;
  private final String name;
  private final Set<String> eventTypes;
  private final EventStore eventStore;
  private final CheckpointStore checkpointStore;
  private final UnitOfWork unitOfWork;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final long intervalMs;
  private final MetricsExporter metrics;

  private final Object pollLock = new Object();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  // guarded by pollLock
  private boolean loaded;
  private long observedHead;
  private long failingSequence = -1L;
  private int failedAttempts;
  private Instant nextAttemptAt;

  private volatile ProjectionState state = ProjectionState.STOPPED;
  private volatile long checkpoint;
  private volatile Long stalledSequence;
  private volatile String lastError;

  ProjectionRunner(Projection projection, ProjectionManager.Builder settings) {
    this.projection = Objects.requireNonNull(projection, "projection");
    this.name = Objects.requireNonNull(projection.name(), "projection name");
    Set<String> types = projection.eventTypes();
    this.eventTypes = types == null ? Set.of() : Set.copyOf(types);
    this.eventStore = settings.eventStore;
    this.checkpointStore = settings.checkpointStore;
    this.unitOfWork = settings.unitOfWork;
    this.retryPolicy = settings.retryPolicy;
    this.maxAttempts = settings.maxAttempts;
    this.batchSize = settings.batchSize;
    this.intervalMs = settings.intervalMs;
    this.metrics = settings.metrics;
  }

  String name() {
    return name;
  }

  /**
   * Schedules the polling loop. The first poll runs immediately. Subsequent calls are
   * no-ops while running.
   */
  synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Projection runner " + name + " has been closed");
    }
    if (pollTask != null) {
      return;
    }
    if (state == ProjectionState.STOPPED) {
      state = ProjectionState.CATCHING_UP;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new ProjectionThreadFactory(name));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, intervalMs, TimeUnit.MILLISECONDS);
    logger.info("Started projection " + name);
  }

  /**
   * Runs one poll cycle. Called by the scheduler; may also be invoked directly.
   */
  void poll() {
    synchronized (pollLock) {
      if (closed) {
        return;
      }
      try {
        if (!loaded) {
          loadCheckpoint();
        }
        if (state == ProjectionState.STALLED) {
          return;
        }
        if (nextAttemptAt != null && Instant.now().isBefore(nextAttemptAt)) {
          return;
        }
        // read before the page: every sequence up to here is already committed
        long head = eventStore.headSequence();
        List<StoredEvent> page = eventStore.readAll(checkpoint + 1, batchSize, eventTypes);
        boolean completed = true;
        for (StoredEvent event : page) {
          if (!process(event)) {
            completed = false;
            break;
          }
        }
        boolean drained = completed && page.size() < batchSize;
        if (drained && head > checkpoint) {
          advancePastUnhandled(head);
        }
        if (completed && state == ProjectionState.CATCHING_UP
            && (checkpoint >= observedHead || drained)) {
          state = ProjectionState.LIVE;
          logger.info("Projection " + name + " caught up at sequence " + checkpoint);
        }
        metrics.recordProjectionLag(name, Math.max(0L, eventStore.headSequence() - checkpoint));
      } catch (StoreUnavailableException e) {
        logger.log(Level.WARNING, "Event store unavailable for projection " + name + ", retrying next cycle", e);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Poll cycle failed for projection " + name, t);
      }
    }
  }

  private void loadCheckpoint() {
    ProjectionCheckpoint stored = checkpointStore.load(name);
    checkpoint = stored.lastProcessedSequence();
    observedHead = eventStore.headSequence();
    loaded = true;
    if (stored.isStalled()) {
      stalledSequence = stored.stalledSequence();
      lastError = stored.lastError();
      state = ProjectionState.STALLED;
      logger.warning("Projection " + name + " is stalled at poison event " + stalledSequence
          + "; release or skip it to resume");
    } else if (state != ProjectionState.LIVE) {
      state = ProjectionState.CATCHING_UP;
    }
  }

  private boolean process(StoredEvent event) {
    try {
      unitOfWork.execute(() -> {
        projection.apply(event);
        checkpointStore.save(name, event.globalSequence());
      });
    } catch (StoreUnavailableException e) {
      // infrastructure, not the event: retried on the next cycle without using up attempts
      throw e;
    } catch (Exception e) {
      return handleFailure(event, e);
    }
    checkpoint = event.globalSequence();
    failingSequence = -1L;
    failedAttempts = 0;
    nextAttemptAt = null;
    lastError = null;
    metrics.incrementProjectionApplied(name);
    return true;
  }

  /**
   * Moves the checkpoint over trailing events of types this projection does not handle.
   */
  private void advancePastUnhandled(long head) {
    runInUnitOfWork("advance checkpoint", () -> checkpointStore.save(name, head));
    checkpoint = head;
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Projection " + name + " advanced past unhandled events to " + head);
    }
  }

  private boolean handleFailure(StoredEvent event, Exception failure) {
    long sequence = event.globalSequence();
    if (failingSequence != sequence) {
      failingSequence = sequence;
      failedAttempts = 0;
    }
    failedAttempts++;
    lastError = String.valueOf(failure.getMessage());

    if (failure instanceof EventSerializationException || failedAttempts >= maxAttempts) {
      stall(event, failure);
      return false;
    }
    long delayMs = retryPolicy.computeDelayMs(failedAttempts);
    nextAttemptAt = Instant.now().plusMillis(delayMs);
    metrics.incrementProjectionRetry(name);
    logger.log(Level.WARNING, "Projection " + name + " failed on " + event.eventType()
        + " at sequence " + sequence + " (attempt " + failedAttempts + "/" + maxAttempts
        + "), retrying in " + delayMs + " ms", failure);
    return false;
  }

  private void stall(StoredEvent event, Exception cause) {
    ProjectionApplyException poison = new ProjectionApplyException(name, event.globalSequence(), cause);
    logger.log(Level.SEVERE, "Poison event " + event.eventId() + " (" + event.eventType()
        + ", stream " + event.streamId() + " v" + event.version() + ") stalled projection " + name
        + " at checkpoint " + checkpoint + " after " + failedAttempts + " attempt(s)", poison);
    stalledSequence = event.globalSequence();
    state = ProjectionState.STALLED;
    nextAttemptAt = null;
    metrics.incrementProjectionPoison(name);
    try {
      checkpointStore.markStalled(name, event.globalSequence(), poison.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record poison event for projection " + name, e);
    }
  }

  /**
   * Clears a stall so the poison event is attempted again with a fresh retry budget.
   *
   * @return {@code true} if the runner was stalled
   */
  boolean release() {
    synchronized (pollLock) {
      if (state != ProjectionState.STALLED) {
        return false;
      }
      checkpointStore.clearStalled(name);
      logger.warning("Released poison event " + stalledSequence + " for projection " + name);
      resume();
      return true;
    }
  }

  /**
   * Advances the checkpoint past the poison event without applying it.
   *
   * @return {@code true} if the runner was stalled
   */
  boolean skip() {
    synchronized (pollLock) {
      if (state != ProjectionState.STALLED || stalledSequence == null) {
        return false;
      }
      long skipped = stalledSequence;
      runInUnitOfWork("skip poison event", () -> checkpointStore.save(name, skipped));
      // stall records live outside the unit of work
      checkpointStore.clearStalled(name);
      checkpoint = skipped;
      logger.warning("Skipped poison event at sequence " + skipped + " for projection " + name
          + "; the read model does not reflect it");
      resume();
      return true;
    }
  }

  /**
   * Clears the read model and checkpoint and starts catching up from sequence zero.
   * A running runner picks the work up on its next poll.
   */
  void rebuild() {
    synchronized (pollLock) {
      runInUnitOfWork("rebuild", () -> {
        projection.reset();
        checkpointStore.reset(name);
      });
      checkpoint = 0L;
      observedHead = eventStore.headSequence();
      loaded = true;
      logger.info("Rebuilding projection " + name + " from sequence 0");
      resume();
    }
  }

  private void resume() {
    stalledSequence = null;
    lastError = null;
    failingSequence = -1L;
    failedAttempts = 0;
    nextAttemptAt = null;
    state = pollTask == null && !loaded ? ProjectionState.STOPPED : ProjectionState.CATCHING_UP;
  }

  private void runInUnitOfWork(String action, UnitOfWork.Work work) {
    try {
      unitOfWork.execute(work);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new EventSourcingException("Failed to " + action + " for projection " + name, e);
    }
  }

  ProjectionStatus status() {
    return new ProjectionStatus(name, state, checkpoint, stalledSequence, lastError);
  }

  /**
   * Cancels the polling schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    state = ProjectionState.STOPPED;
  }
}
