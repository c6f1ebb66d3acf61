package io.eventsource.projection;

import io.eventsource.model.ProjectionState;

/**
 * Point-in-time view of a projection runner.
 *
 * @param projectionName  the projection
 * @param state           lifecycle state
 * @param checkpoint      last processed global sequence
 * @param stalledSequence poison event sequence when {@code STALLED}, else {@code null}
 * @param lastError       last apply failure message, or {@code null}
 */
public record ProjectionStatus(
    String projectionName,
    ProjectionState state,
    long checkpoint,
    Long stalledSequence,
    String lastError
) {}
