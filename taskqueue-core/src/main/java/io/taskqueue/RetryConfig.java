package io.taskqueue;

import io.taskqueue.retry.ExponentialBackoffRetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry-policy descriptor stored with every Task Record.
 *
 * <p>The descriptor is informational for the queue itself: the worker runner never
 * re-dispatches a failed task on its own. Handlers read it to decide when a failure is
 * final (for example to raise a dead-letter alert), and
 * {@link io.taskqueue.retry.TaskRequeuer} uses it to schedule successor tasks.
 *
 * @param maxAttempts total attempts allowed, including the first one
 * @param minBackoff  delay before the first retry
 * @param maxBackoff  upper bound for any retry delay
 */
public record RetryConfig(int maxAttempts, Duration minBackoff, Duration maxBackoff) {

  /**
   * Five attempts, one minute to fifteen minutes.
   */
  public static final RetryConfig DEFAULT = of(5, 60, 900);

  public RetryConfig {
    Objects.requireNonNull(minBackoff, "minBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (minBackoff.isNegative() || minBackoff.isZero()) {
      throw new IllegalArgumentException("minBackoff must be positive, got: " + minBackoff);
    }
    if (maxBackoff.compareTo(minBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= minBackoff");
    }
  }

  /**
   * Creates a descriptor from second-based backoff bounds.
   */
  public static RetryConfig of(int maxAttempts, long minBackoffSeconds, long maxBackoffSeconds) {
    return new RetryConfig(maxAttempts,
        Duration.ofSeconds(minBackoffSeconds), Duration.ofSeconds(maxBackoffSeconds));
  }

  /**
   * Returns whether a task that has already been attempted {@code attempts} times may
   * not be attempted again.
   *
   * @param attempts completed attempts
   * @return {@code true} once {@code attempts >= maxAttempts}
   */
  public boolean isExhausted(int attempts) {
    return attempts >= maxAttempts;
  }

  /**
   * Computes the delay before the next attempt, with jitter.
   *
   * @param attempt completed attempts so far (1-based)
   * @return the backoff, never above {@link #maxBackoff()}
   */
  public Duration backoffFor(int attempt) {
    return new ExponentialBackoffRetryPolicy(minBackoff, maxBackoff).delayAfter(attempt);
  }
}
