package io.taskqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.taskqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily the first time a queue reports, each tagged with
 * {@code queue=<name>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code taskqueue.tasks.claimed} - tasks claimed by a runner</li>
 *   <li>{@code taskqueue.polls.idle} - poll cycles that found nothing eligible</li>
 *   <li>{@code taskqueue.tasks.succeeded} - tasks recorded SUCCEEDED</li>
 *   <li>{@code taskqueue.tasks.failed} - tasks recorded FAILED from a failed result</li>
 *   <li>{@code taskqueue.tasks.exhausted} - tasks that failed their last allowed attempt</li>
 *   <li>{@code taskqueue.runner.failures} - handler invocations that threw</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code taskqueue.handler.duration.ms} - handler execution time only</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, QueueMeters> byQueue = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "taskqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "taskqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "wellness.tasks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementClaimed(String queue) {
    if (closed) return;
    meters(queue).claimed.increment();
  }

  @Override
  public void incrementIdlePolls(String queue) {
    if (closed) return;
    meters(queue).idlePolls.increment();
  }

  @Override
  public void incrementSucceeded(String queue) {
    if (closed) return;
    meters(queue).succeeded.increment();
  }

  @Override
  public void incrementFailed(String queue) {
    if (closed) return;
    meters(queue).failed.increment();
  }

  @Override
  public void incrementRunnerFailures(String queue) {
    if (closed) return;
    meters(queue).runnerFailures.increment();
  }

  @Override
  public void incrementExhausted(String queue) {
    if (closed) return;
    meters(queue).exhausted.increment();
  }

  @Override
  public void recordHandlerDurationMs(String queue, long durationMs) {
    if (closed) return;
    meters(queue).handlerDuration.record(durationMs);
  }

  private QueueMeters meters(String queue) {
    return byQueue.computeIfAbsent(queue, q -> new QueueMeters(registry, namePrefix, q));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the worker pool is closed to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (QueueMeters meters : byQueue.values()) {
      for (Meter meter : meters.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
    }
    byQueue.clear();
    if (first != null) throw first;
  }

  private static final class QueueMeters {
    final Counter claimed;
    final Counter idlePolls;
    final Counter succeeded;
    final Counter failed;
    final Counter exhausted;
    final Counter runnerFailures;
    final DistributionSummary handlerDuration;

    QueueMeters(MeterRegistry registry, String prefix, String queue) {
      claimed = counter(registry, prefix + ".tasks.claimed", "Tasks claimed by a runner", queue);
      idlePolls = counter(registry, prefix + ".polls.idle", "Poll cycles with nothing eligible", queue);
      succeeded = counter(registry, prefix + ".tasks.succeeded", "Tasks recorded SUCCEEDED", queue);
      failed = counter(registry, prefix + ".tasks.failed", "Tasks recorded FAILED", queue);
      exhausted = counter(registry, prefix + ".tasks.exhausted",
          "Tasks that failed their last allowed attempt", queue);
      runnerFailures = counter(registry, prefix + ".runner.failures", "Handler invocations that threw", queue);
      handlerDuration = DistributionSummary.builder(prefix + ".handler.duration.ms")
          .description("Handler execution time in milliseconds")
          .tag("queue", queue)
          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String queue) {
      return Counter.builder(name)
          .description(description)
          .tag("queue", queue)
          .register(registry);
    }

    List<Meter> all() {
      List<Meter> meters = new ArrayList<>(List.of(claimed, idlePolls, succeeded, failed,
          exhausted, runnerFailures));
      meters.add(handlerDuration);
      return meters;
    }
  }
}
