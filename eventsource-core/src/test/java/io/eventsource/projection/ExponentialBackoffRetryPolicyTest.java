package io.eventsource.projection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(200, 60_000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 100 && delay < 300, "got " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000);

    long delay3 = policy.computeDelayMs(3);
    long delay5 = policy.computeDelayMs(5);

    assertTrue(delay3 >= 200 && delay3 < 600, "attempt 3: " + delay3);
    assertTrue(delay5 >= 800 && delay5 < 2400, "attempt 5: " + delay5);
  }

  @Test
  void delayNeverExceedsMax() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt <= 100; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay > 0 && delay <= 500, "attempt " + attempt + ": " + delay);
    }
  }

  @Test
  void nonPositiveAttemptsHaveNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-3));
  }

  @Test
  void constructorValidatesBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(500, 100));
  }
}
