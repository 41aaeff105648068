package io.taskqueue.runner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-level worker configuration.
 *
 * @param queues        queues to run; empty means every queue with a registered handler
 * @param pollInterval  wait after a poll cycle that found nothing
 * @param errorBackoff  wait after a handler threw
 * @param drainTimeout  how long {@code close()} waits for in-flight handlers
 */
public record RunnerConfig(
    List<String> queues,
    Duration pollInterval,
    Duration errorBackoff,
    Duration drainTimeout
) {
  public static final String QUEUES_VARIABLE = "WORKER_QUEUES";
  public static final String POLL_INTERVAL_VARIABLE = "WORKER_POLL_INTERVAL_MS";
  public static final String ERROR_BACKOFF_VARIABLE = "WORKER_ERROR_BACKOFF_MS";
  public static final String DRAIN_TIMEOUT_VARIABLE = "WORKER_DRAIN_TIMEOUT_MS";

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(5000);
  public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofMillis(2000);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMillis(30000);

  public RunnerConfig {
    queues = List.copyOf(Objects.requireNonNull(queues, "queues"));
    requirePositive(pollInterval, "pollInterval");
    requirePositive(errorBackoff, "errorBackoff");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
  }

  /**
   * All registered queues with the default timings.
   */
  public static RunnerConfig defaults() {
    return new RunnerConfig(List.of(), DEFAULT_POLL_INTERVAL, DEFAULT_ERROR_BACKOFF, DEFAULT_DRAIN_TIMEOUT);
  }

  /**
   * Reads the configuration from environment-style variables.
   *
   * <ul>
   *   <li>{@code WORKER_QUEUES}: comma-separated queue names (blank entries ignored)</li>
   *   <li>{@code WORKER_POLL_INTERVAL_MS}: defaults to 5000</li>
   *   <li>{@code WORKER_ERROR_BACKOFF_MS}: defaults to 2000</li>
   *   <li>{@code WORKER_DRAIN_TIMEOUT_MS}: defaults to 30000</li>
   * </ul>
   *
   * @param env variables, typically {@link System#getenv()}
   * @return the parsed configuration
   * @throws IllegalArgumentException if a numeric variable is not a positive integer
   */
  public static RunnerConfig fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    return new RunnerConfig(
        parseQueues(env.get(QUEUES_VARIABLE)),
        parseMillis(env, POLL_INTERVAL_VARIABLE, DEFAULT_POLL_INTERVAL),
        parseMillis(env, ERROR_BACKOFF_VARIABLE, DEFAULT_ERROR_BACKOFF),
        parseMillis(env, DRAIN_TIMEOUT_VARIABLE, DEFAULT_DRAIN_TIMEOUT));
  }

  public RunnerConfig withQueues(List<String> queues) {
    return new RunnerConfig(queues, pollInterval, errorBackoff, drainTimeout);
  }

  static List<String> parseQueues(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> queues = new ArrayList<>();
    for (String part : raw.split(",")) {
      String queue = part.trim();
      if (!queue.isEmpty() && !queues.contains(queue)) {
        queues.add(queue);
      }
    }
    return queues;
  }

  private static Duration parseMillis(Map<String, String> env, String variable, Duration fallback) {
    String raw = env.get(variable);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    long millis;
    try {
      millis = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(variable + " must be an integer, got: " + raw, e);
    }
    if (millis <= 0) {
      throw new IllegalArgumentException(variable + " must be > 0, got: " + raw);
    }
    return Duration.ofMillis(millis);
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
