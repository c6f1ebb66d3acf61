package io.eventsource.projection;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code baseDelay * 2^(attempts-1)}, capped at
 * {@code maxDelay}, multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long capped = maxDelayMs;
    int shift = attempts - 1;
    // baseDelayMs << shift overflows long once shift passes 62
    if (shift < 62 && baseDelayMs <= (maxDelayMs >> shift)) {
      capped = baseDelayMs << shift;
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (capped * jitter));
  }
}
