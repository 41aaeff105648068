package io.taskqueue.model;

import io.taskqueue.RetryConfig;

import java.time.Instant;

/**
 * Persistent Task Record as read from the task store.
 *
 * @param id             store-assigned sequence (creation order)
 * @param name           unique task name
 * @param queue          queue the task belongs to
 * @param status         current lifecycle status
 * @param payloadJson    opaque business payload
 * @param retryConfig    retry-policy descriptor
 * @param scheduleTime   earliest dispatch time, or {@code null} for immediately eligible
 * @param attemptCount   completed attempts
 * @param firstAttemptAt time of the first attempt, or {@code null}
 * @param lastAttemptAt  time of the latest attempt, or {@code null}
 * @param errorMessage   last error, or {@code null}
 * @param jobId          optional Domain Job Record id
 * @param retryOf        name of the task this one re-queues, or {@code null}
 * @param createdAt      insertion time
 */
public record TaskRecord(
    long id,
    String name,
    String queue,
    TaskStatus status,
    String payloadJson,
    RetryConfig retryConfig,
    Instant scheduleTime,
    int attemptCount,
    Instant firstAttemptAt,
    Instant lastAttemptAt,
    String errorMessage,
    String jobId,
    String retryOf,
    Instant createdAt
) {

  /**
   * Returns whether the task may still be dispatched at {@code now}.
   */
  public boolean isEligibleAt(Instant now) {
    return status == TaskStatus.PENDING && (scheduleTime == null || !scheduleTime.isAfter(now));
  }

  /**
   * Returns whether the retry descriptor forbids another attempt.
   */
  public boolean isExhausted() {
    return retryConfig.isExhausted(attemptCount);
  }
}
