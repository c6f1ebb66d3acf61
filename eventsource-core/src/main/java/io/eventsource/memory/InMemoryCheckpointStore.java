package io.eventsource.memory;

import io.eventsource.model.ProjectionCheckpoint;
import io.eventsource.spi.CheckpointStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link CheckpointStore} held in a concurrent map. Pair it with
 * {@link io.eventsource.spi.UnitOfWork#DIRECT} and an in-memory read model.
 */
public final class InMemoryCheckpointStore implements CheckpointStore {
  private final ConcurrentMap<String, ProjectionCheckpoint> checkpoints = new ConcurrentHashMap<>();

  @Override
  public void initialize() {
  }

  @Override
  public ProjectionCheckpoint load(String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    ProjectionCheckpoint checkpoint = checkpoints.get(projectionName);
    return checkpoint != null ? checkpoint : ProjectionCheckpoint.initial(projectionName);
  }

  @Override
  public void save(String projectionName, long lastProcessedSequence) {
    checkpoints.compute(projectionName, (name, current) -> {
      ProjectionCheckpoint base = current != null ? current : ProjectionCheckpoint.initial(name);
      long next = Math.max(base.lastProcessedSequence(), lastProcessedSequence);
      return new ProjectionCheckpoint(name, next, base.stalledSequence(), base.lastError(), Instant.now());
    });
  }

  @Override
  public void markStalled(String projectionName, long stalledSequence, String error) {
    checkpoints.compute(projectionName, (name, current) -> {
      ProjectionCheckpoint base = current != null ? current : ProjectionCheckpoint.initial(name);
      return new ProjectionCheckpoint(name, base.lastProcessedSequence(), stalledSequence, error, Instant.now());
    });
  }

  @Override
  public void clearStalled(String projectionName) {
    checkpoints.computeIfPresent(projectionName, (name, current) ->
        new ProjectionCheckpoint(name, current.lastProcessedSequence(), null, null, Instant.now()));
  }

  @Override
  public void reset(String projectionName) {
    checkpoints.put(projectionName, new ProjectionCheckpoint(projectionName, 0L, null, null, Instant.now()));
  }

  @Override
  public List<ProjectionCheckpoint> findStalled() {
    List<ProjectionCheckpoint> stalled = new ArrayList<>();
    for (ProjectionCheckpoint checkpoint : checkpoints.values()) {
      if (checkpoint.isStalled()) {
        stalled.add(checkpoint);
      }
    }
    stalled.sort((a, b) -> a.projectionName().compareTo(b.projectionName()));
    return stalled;
  }
}
