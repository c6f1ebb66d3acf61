package io.eventsource.model;

/**
 * Lifecycle of a projection runner: STOPPED → CATCHING_UP → LIVE, or STALLED
 * while a poison event blocks its checkpoint.
 */
public enum ProjectionState {
  STOPPED,
  CATCHING_UP,
  LIVE,
  STALLED
}
