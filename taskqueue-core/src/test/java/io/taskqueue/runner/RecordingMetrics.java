package io.taskqueue.runner;

import io.taskqueue.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

class RecordingMetrics implements MetricsExporter {
  final AtomicInteger claimed = new AtomicInteger();
  final AtomicInteger idlePolls = new AtomicInteger();
  final AtomicInteger succeeded = new AtomicInteger();
  final AtomicInteger failed = new AtomicInteger();
  final AtomicInteger runnerFailures = new AtomicInteger();
  final AtomicInteger exhausted = new AtomicInteger();
  final AtomicInteger durations = new AtomicInteger();

  @Override
  public void incrementClaimed(String queue) {
    claimed.incrementAndGet();
  }

  @Override
  public void incrementIdlePolls(String queue) {
    idlePolls.incrementAndGet();
  }

  @Override
  public void incrementSucceeded(String queue) {
    succeeded.incrementAndGet();
  }

  @Override
  public void incrementFailed(String queue) {
    failed.incrementAndGet();
  }

  @Override
  public void incrementRunnerFailures(String queue) {
    runnerFailures.incrementAndGet();
  }

  @Override
  public void incrementExhausted(String queue) {
    exhausted.incrementAndGet();
  }

  @Override
  public void recordHandlerDurationMs(String queue, long durationMs) {
    durations.incrementAndGet();
  }
}
