package io.taskqueue.wellness.insight;

import java.time.Instant;
import java.util.Objects;

/**
 * A delivered insight. At most one exists per generation job.
 *
 * @param bodyJson {@code {"insights": [...], "recommendations": [...]}}
 */
public record Insight(
    String id,
    String userId,
    String jobId,
    String title,
    String summary,
    String bodyJson,
    String modelUsed,
    Instant generatedAt
) {

  public Insight {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(bodyJson, "bodyJson");
    Objects.requireNonNull(generatedAt, "generatedAt");
  }
}
