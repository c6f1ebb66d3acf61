package io.eventsource.projection;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Daemon threads for one projection runner, named {@code projection-<name>-<n>}.
 *
 * <p>Exceptions escaping a thread are logged at SEVERE under the projection's name.
 */
final class ProjectionThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(ProjectionThreadFactory.class.getName());

  private final String projectionName;
  private final AtomicInteger counter = new AtomicInteger(1);

  ProjectionThreadFactory(String projectionName) {
    this.projectionName = Objects.requireNonNull(projectionName, "projectionName");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "projection-" + projectionName + "-" + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Projection " + projectionName + " thread " + t.getName() + " died", e));
    return thread;
  }
}
