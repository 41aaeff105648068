package io.taskqueue.wellness.insight;

import io.taskqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.Optional;

import static io.taskqueue.jdbc.JdbcTemplate.instant;
import static io.taskqueue.jdbc.JdbcTemplate.timestamp;

/**
 * {@link InsightRepository} over table {@code insight}.
 */
public final class JdbcInsightRepository implements InsightRepository {
  private static final String COLUMNS =
      "id, user_id, job_id, title, summary, body, model_used, generated_at";

  private static final JdbcTemplate.RowMapper<Insight> ROW_MAPPER = rs -> new Insight(
      rs.getString("id"),
      rs.getString("user_id"),
      rs.getString("job_id"),
      rs.getString("title"),
      rs.getString("summary"),
      rs.getString("body"),
      rs.getString("model_used"),
      instant(rs, "generated_at"));

  @Override
  public void insert(Connection conn, Insight insight) {
    String sql = "INSERT INTO insight (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        insight.id(), insight.userId(), insight.jobId(), insight.title(), insight.summary(),
        insight.bodyJson(), insight.modelUsed(), timestamp(insight.generatedAt()));
  }

  @Override
  public Optional<Insight> findByJobId(Connection conn, String jobId) {
    String sql = "SELECT " + COLUMNS + " FROM insight WHERE job_id=?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, jobId).stream().findFirst();
  }
}
