package io.taskqueue.enqueue;

import io.taskqueue.RetryConfig;

import java.time.Instant;

/**
 * Optional settings for a single enqueue call. Every component may be {@code null}.
 *
 * @param taskName      explicit unique name; generated when {@code null}
 * @param discriminator key used in the generated name (e.g. a user id)
 * @param scheduleTime  earliest dispatch time; immediately eligible when {@code null}
 * @param jobId         id of the Domain Job Record the task drives
 * @param retryConfig   retry descriptor; the enqueuer's default when {@code null}
 */
public record EnqueueOptions(
    String taskName,
    String discriminator,
    Instant scheduleTime,
    String jobId,
    RetryConfig retryConfig
) {

  private static final EnqueueOptions NONE = new EnqueueOptions(null, null, null, null, null);

  public static EnqueueOptions none() {
    return NONE;
  }

  public EnqueueOptions withTaskName(String taskName) {
    return new EnqueueOptions(taskName, discriminator, scheduleTime, jobId, retryConfig);
  }

  public EnqueueOptions withDiscriminator(String discriminator) {
    return new EnqueueOptions(taskName, discriminator, scheduleTime, jobId, retryConfig);
  }

  public EnqueueOptions withScheduleTime(Instant scheduleTime) {
    return new EnqueueOptions(taskName, discriminator, scheduleTime, jobId, retryConfig);
  }

  public EnqueueOptions withJobId(String jobId) {
    return new EnqueueOptions(taskName, discriminator, scheduleTime, jobId, retryConfig);
  }

  public EnqueueOptions withRetryConfig(RetryConfig retryConfig) {
    return new EnqueueOptions(taskName, discriminator, scheduleTime, jobId, retryConfig);
  }
}
