package io.eventsource;

/**
 * Failure while folding a stored event into a projection's read model.
 */
public final class ProjectionApplyException extends EventSourcingException {
  private final String projectionName;
  private final long globalSequence;

  public ProjectionApplyException(String projectionName, long globalSequence, Throwable cause) {
    super("Projection " + projectionName + " failed to apply event at sequence " + globalSequence
        + ": " + (cause == null ? null : cause.getMessage()), cause);
    this.projectionName = projectionName;
    this.globalSequence = globalSequence;
  }

  public String projectionName() {
    return projectionName;
  }

  public long globalSequence() {
    return globalSequence;
  }
}
