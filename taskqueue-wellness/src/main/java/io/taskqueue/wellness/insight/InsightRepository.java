package io.taskqueue.wellness.insight;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence for delivered {@link Insight}s; the job id is unique.
 */
public interface InsightRepository {

  void insert(Connection conn, Insight insight);

  Optional<Insight> findByJobId(Connection conn, String jobId);
}
