package io.eventsource.spi;

import io.eventsource.model.ProjectionCheckpoint;

import java.util.List;

/**
 * Durable per-projection progress.
 *
 * <p>{@link #save} must participate in the caller's {@link UnitOfWork} so that the
 * checkpoint and the read-model write commit together. {@link #markStalled} and
 * {@link #clearStalled} are written outside of it: they must survive the rollback of
 * the failed apply.
 */
public interface CheckpointStore {

  /**
   * Creates the backing schema if missing. Idempotent.
   */
  void initialize();

  /**
   * Returns the checkpoint for a projection, or {@link ProjectionCheckpoint#initial} when
   * none has been written yet.
   */
  ProjectionCheckpoint load(String projectionName);

  /**
   * Advances the checkpoint. Never moves it backwards.
   */
  void save(String projectionName, long lastProcessedSequence);

  /**
   * Records a poison event. The checkpoint itself is left unchanged.
   */
  void markStalled(String projectionName, long stalledSequence, String error);

  /**
   * Clears a previously recorded poison event.
   */
  void clearStalled(String projectionName);

  /**
   * Resets the checkpoint to zero and clears any stall, for a rebuild.
   */
  void reset(String projectionName);

  /**
   * Returns all projections currently blocked by a poison event.
   */
  List<ProjectionCheckpoint> findStalled();
}
