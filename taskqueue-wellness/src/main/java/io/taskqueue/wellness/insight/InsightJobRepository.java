package io.taskqueue.wellness.insight;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for {@link InsightGenerationJob} records. Methods run on the caller's
 * connection so job creation can share a transaction with the enqueue.
 */
public interface InsightJobRepository {

  void insert(Connection conn, InsightGenerationJob job);

  Optional<InsightGenerationJob> findById(Connection conn, String id);

  /**
   * Overwrites the mutable columns of an existing job.
   *
   * @return rows updated (0 if the job does not exist)
   */
  int update(Connection conn, InsightGenerationJob job);

  /** Any QUEUED or RUNNING job requested by the user. */
  Optional<InsightGenerationJob> findActiveByUser(Connection conn, String userId);

  int countCreatedSince(Connection conn, String userId, Instant since);
}
