package io.taskqueue.wellness.insight;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain Job Record for one insight generation request, linked to its task by name.
 */
public record InsightGenerationJob(
    String id,
    String requestedBy,
    InsightJobStatus status,
    String queue,
    String taskName,
    InsightJobPayload payload,
    Instant createdAt,
    Instant dispatchedAt,
    Instant completedAt,
    String insightId,
    String errorCode,
    String errorMessage
) {

  public static final String PROVIDER_FAILURE = "INSIGHT_PROVIDER_FAILURE";

  public InsightGenerationJob {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(requestedBy, "requestedBy");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public static InsightGenerationJob queued(String id, String requestedBy, String queue, String taskName,
      InsightJobPayload payload, Instant createdAt) {
    return new InsightGenerationJob(id, requestedBy, InsightJobStatus.QUEUED, queue, taskName, payload,
        createdAt, null, null, null, null, null);
  }

  /**
   * Moves the job to RUNNING, keeping the first dispatch time across re-dispatches.
   */
  public InsightGenerationJob running(Instant now) {
    return new InsightGenerationJob(id, requestedBy, InsightJobStatus.RUNNING, queue, taskName, payload,
        createdAt, dispatchedAt != null ? dispatchedAt : now, completedAt, insightId, errorCode, errorMessage);
  }

  public InsightGenerationJob withPayload(InsightJobPayload payload) {
    return new InsightGenerationJob(id, requestedBy, status, queue, taskName, payload,
        createdAt, dispatchedAt, completedAt, insightId, errorCode, errorMessage);
  }

  public InsightGenerationJob succeeded(String insightId, InsightJobPayload payload, Instant now) {
    return new InsightGenerationJob(id, requestedBy, InsightJobStatus.SUCCEEDED, queue, taskName, payload,
        createdAt, dispatchedAt, now, insightId, null, null);
  }

  public InsightGenerationJob failed(String errorCode, String errorMessage, InsightJobPayload payload,
      Instant now) {
    return new InsightGenerationJob(id, requestedBy, InsightJobStatus.FAILED, queue, taskName, payload,
        createdAt, dispatchedAt, now, insightId, errorCode, errorMessage);
  }
}
