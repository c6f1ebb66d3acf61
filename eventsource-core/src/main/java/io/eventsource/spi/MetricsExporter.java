package io.eventsource.spi;

/**
 * Observability hook for exporting store and projection counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Counts events committed by a successful append.
   *
   * @param count number of events in the batch
   */
  void incrementAppended(int count);

  /**
   * Counts appends rejected with a concurrency conflict.
   */
  void incrementConflicts();

  /**
   * Counts events applied by a projection.
   */
  void incrementProjectionApplied(String projectionName);

  /**
   * Counts failed apply attempts that will be retried.
   */
  void incrementProjectionRetry(String projectionName);

  /**
   * Counts poison events that stalled a projection.
   */
  void incrementProjectionPoison(String projectionName);

  /**
   * Records how many global sequences a projection is behind the head of the log.
   */
  void recordProjectionLag(String projectionName, long lag);

  final class Noop implements MetricsExporter {
    private Noop() {
    }

    @Override
    public void incrementAppended(int count) {
    }

    @Override
    public void incrementConflicts() {
    }

    @Override
    public void incrementProjectionApplied(String projectionName) {
    }

    @Override
    public void incrementProjectionRetry(String projectionName) {
    }

    @Override
    public void incrementProjectionPoison(String projectionName) {
    }

    @Override
    public void recordProjectionLag(String projectionName, long lag) {
    }
  }
}
