package io.eventsource.model;

import java.time.Instant;

/**
 * Persisted progress of one projection.
 *
 * @param projectionName        unique projection name
 * @param lastProcessedSequence last global sequence whose effects are durable in the read model
 * @param stalledSequence       sequence of the poison event blocking progress, or {@code null}
 * @param lastError             failure message recorded with the poison event, or {@code null}
 * @param updatedAt             last time the row was written
 */
public record ProjectionCheckpoint(
    String projectionName,
    long lastProcessedSequence,
    Long stalledSequence,
    String lastError,
    Instant updatedAt
) {

  public static ProjectionCheckpoint initial(String projectionName) {
    return new ProjectionCheckpoint(projectionName, 0L, null, null, null);
  }

  public boolean isStalled() {
    return stalledSequence != null;
  }
}
