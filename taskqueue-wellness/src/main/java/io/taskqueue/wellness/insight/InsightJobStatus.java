package io.taskqueue.wellness.insight;

/**
 * Lifecycle of an {@link InsightGenerationJob}.
 */
public enum InsightJobStatus {
  QUEUED,
  RUNNING,
  SUCCEEDED,
  FAILED;

  /** Jobs in these states block a new request from the same user. */
  public boolean isActive() {
    return this == QUEUED || this == RUNNING;
  }
}
