package io.taskqueue.retry;

import java.time.Duration;

/**
 * Computes how long a failed task waits before its successor becomes eligible.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts attempts completed so far; zero or less means no delay
   * @return the delay, never negative
   */
  Duration delayAfter(int attempts);
}
