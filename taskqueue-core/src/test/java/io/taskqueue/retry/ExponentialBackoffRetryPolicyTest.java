package io.taskqueue.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void noDelayBeforeAnyAttempt() {
    RetryPolicy policy = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofMinutes(1));

    assertEquals(Duration.ZERO, policy.delayAfter(0));
    assertEquals(Duration.ZERO, policy.delayAfter(-3));
  }

  @Test
  void thirdAttemptWaitsAroundFourTimesTheMinimum() {
    RetryPolicy policy = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofMinutes(10));

    for (int i = 0; i < 50; i++) {
      long third = policy.delayAfter(3).toMillis();
      assertTrue(third >= 2000 && third < 6000, "got " + third);
    }
  }

  @Test
  void largeAttemptCountsStayUnderTheCap() {
    RetryPolicy policy = new ExponentialBackoffRetryPolicy(Duration.ofSeconds(60), Duration.ofSeconds(900));

    for (int attempts : new int[]{10, 30, 31, 64, Integer.MAX_VALUE}) {
      long delay = policy.delayAfter(attempts).toMillis();
      assertTrue(delay <= 900_000 && delay >= 450_000, attempts + " -> " + delay);
    }
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffRetryPolicy(Duration.ZERO, Duration.ofSeconds(10)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffRetryPolicy(Duration.ofSeconds(100), Duration.ofSeconds(10)));
  }
}
