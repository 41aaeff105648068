package io.taskqueue.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code minBackoff * 2^(attempts-1)}, capped at
 * {@code maxBackoff}, scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long minBackoffMs;
  private final long maxBackoffMs;

  public ExponentialBackoffRetryPolicy(Duration minBackoff, Duration maxBackoff) {
    Objects.requireNonNull(minBackoff, "minBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (minBackoff.toMillis() <= 0) {
      throw new IllegalArgumentException("minBackoff must be positive, got: " + minBackoff);
    }
    if (maxBackoff.compareTo(minBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= minBackoff, got: " + maxBackoff);
    }
    this.minBackoffMs = minBackoff.toMillis();
    this.maxBackoffMs = maxBackoff.toMillis();
  }

  @Override
  public Duration delayAfter(int attempts) {
    if (attempts <= 0) {
      return Duration.ZERO;
    }
    long exponential;
    if (attempts >= 31) {
      exponential = maxBackoffMs;
    } else {
      long factor = 1L << (attempts - 1);
      // overflow guard
      exponential = factor > maxBackoffMs / minBackoffMs ? maxBackoffMs : minBackoffMs * factor;
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    long jittered = (long) (Math.min(maxBackoffMs, exponential) * jitter);
    return Duration.ofMillis(Math.min(maxBackoffMs, Math.max(0L, jittered)));
  }
}
