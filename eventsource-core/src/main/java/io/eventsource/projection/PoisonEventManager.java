package io.eventsource.projection;

import io.eventsource.model.ProjectionCheckpoint;
import io.eventsource.spi.CheckpointStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for projections stalled on a poison event.
 *
 * <p>A stalled projection stays stalled, across restarts, until one of two decisions is
 * made: {@link #release} retries the same event (after the apply logic or the data has
 * been fixed), {@link #skip} moves the checkpoint past it and leaves the read model
 * without its effect.
 *
 * @see ProjectionManager
 */
public final class PoisonEventManager {
  private static final Logger logger = Logger.getLogger(PoisonEventManager.class.getName());

  private final ProjectionManager projectionManager;
  private final CheckpointStore checkpointStore;

  public PoisonEventManager(ProjectionManager projectionManager, CheckpointStore checkpointStore) {
    this.projectionManager = Objects.requireNonNull(projectionManager, "projectionManager");
    this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
  }

  /**
   * Lists stalled projections as persisted by the checkpoint store, including those of
   * projections not registered with this manager.
   *
   * @return stalled checkpoints, empty if the store cannot be read
   */
  public List<ProjectionCheckpoint> stalled() {
    try {
      return checkpointStore.findStalled();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query stalled projections", e);
      return List.of();
    }
  }

  /**
   * Retries the poison event of a projection with a fresh attempt budget.
   *
   * @return {@code true} if the projection was stalled and has been released
   */
  public boolean release(String projectionName) {
    return projectionManager.release(projectionName);
  }

  /**
   * Advances a projection's checkpoint past its poison event without applying it.
   *
   * @return {@code true} if the projection was stalled and the event has been skipped
   */
  public boolean skip(String projectionName) {
    return projectionManager.skip(projectionName);
  }

  /**
   * Number of projections currently stalled.
   */
  public int count() {
    return stalled().size();
  }
}
