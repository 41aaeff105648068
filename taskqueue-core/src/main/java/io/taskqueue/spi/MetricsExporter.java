package io.taskqueue.spi;

/**
 * Observability hook for exporting worker counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Every method receives the
 * queue name so backends can tag per queue.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of tasks claimed by a runner.
   */
  void incrementClaimed(String queue);

  /**
   * Increments the count of poll cycles that found nothing to claim.
   */
  void incrementIdlePolls(String queue);

  /**
   * Increments the count of tasks recorded SUCCEEDED by a runner.
   */
  void incrementSucceeded(String queue);

  /**
   * Increments the count of tasks recorded FAILED from a handler's failed result.
   */
  void incrementFailed(String queue);

  /**
   * Increments the count of handler invocations that threw.
   */
  void incrementRunnerFailures(String queue);

  /**
   * Increments the count of tasks that failed on their last allowed attempt.
   */
  default void incrementExhausted(String queue) {
  }

  /**
   * Records the time spent inside the handler only.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(String queue, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementClaimed(String queue) {
    }

    @Override
    public void incrementIdlePolls(String queue) {
    }

    @Override
    public void incrementSucceeded(String queue) {
    }

    @Override
    public void incrementFailed(String queue) {
    }

    @Override
    public void incrementRunnerFailures(String queue) {
    }
  }
}
