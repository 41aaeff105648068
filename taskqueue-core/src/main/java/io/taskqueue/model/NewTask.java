package io.taskqueue.model;

import io.taskqueue.RetryConfig;

import java.time.Instant;
import java.util.Objects;

/**
 * Insert-side view of a Task Record. The store assigns the id and sets the status to
 * {@link TaskStatus#PENDING}.
 *
 * <p>Fresh tasks start with zero attempts; successors created by
 * {@link io.taskqueue.retry.TaskRequeuer} carry the attempt count and first attempt
 * time of the task they re-queue.
 */
public record NewTask(
    String name,
    String queue,
    String payloadJson,
    RetryConfig retryConfig,
    Instant scheduleTime,
    String jobId,
    String retryOf,
    int attemptCount,
    Instant firstAttemptAt,
    Instant createdAt
) {

  public NewTask {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(retryConfig, "retryConfig");
    Objects.requireNonNull(createdAt, "createdAt");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    if (queue.isEmpty()) {
      throw new IllegalArgumentException("queue must not be empty");
    }
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0");
    }
  }

  /**
   * Creates a fresh task with zero attempts.
   */
  public static NewTask fresh(String name, String queue, String payloadJson, RetryConfig retryConfig,
      Instant scheduleTime, String jobId, Instant createdAt) {
    return new NewTask(name, queue, payloadJson, retryConfig, scheduleTime, jobId,
        null, 0, null, createdAt);
  }
}
