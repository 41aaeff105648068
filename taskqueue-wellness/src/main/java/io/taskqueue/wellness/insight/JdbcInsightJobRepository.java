package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.jdbc.JdbcTemplate;

import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.taskqueue.jdbc.JdbcTemplate.instant;
import static io.taskqueue.jdbc.JdbcTemplate.timestamp;

/**
 * {@link InsightJobRepository} over table {@code insight_generation_job}; the payload
 * column holds the Jackson-serialized {@link InsightJobPayload}.
 */
public final class JdbcInsightJobRepository implements InsightJobRepository {
  private static final String COLUMNS =
      "id, requested_by, status, queue, task_name, payload, created_at, dispatched_at, completed_at, " +
      "insight_id, error_code, error_message";

  private final ObjectMapper objectMapper;
  private final JdbcTemplate.RowMapper<InsightGenerationJob> rowMapper = this::mapRow;

  public JdbcInsightJobRepository(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public void insert(Connection conn, InsightGenerationJob job) {
    String sql = "INSERT INTO insight_generation_job (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        job.id(), job.requestedBy(), job.status().name(), job.queue(), job.taskName(),
        writePayload(job.payload()), timestamp(job.createdAt()), timestamp(job.dispatchedAt()),
        timestamp(job.completedAt()), job.insightId(), job.errorCode(), job.errorMessage());
  }

  @Override
  public Optional<InsightGenerationJob> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM insight_generation_job WHERE id=?";
    return JdbcTemplate.query(conn, sql, rowMapper, id).stream().findFirst();
  }

  @Override
  public int update(Connection conn, InsightGenerationJob job) {
    String sql = "UPDATE insight_generation_job SET status=?, payload=?, dispatched_at=?, completed_at=?," +
        " insight_id=?, error_code=?, error_message=? WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        job.status().name(), writePayload(job.payload()), timestamp(job.dispatchedAt()),
        timestamp(job.completedAt()), job.insightId(), job.errorCode(), job.errorMessage(), job.id());
  }

  @Override
  public Optional<InsightGenerationJob> findActiveByUser(Connection conn, String userId) {
    String sql = "SELECT " + COLUMNS + " FROM insight_generation_job" +
        " WHERE requested_by=? AND status IN ('" + InsightJobStatus.QUEUED.name() + "','" +
        InsightJobStatus.RUNNING.name() + "') ORDER BY created_at LIMIT 1";
    return JdbcTemplate.query(conn, sql, rowMapper, userId).stream().findFirst();
  }

  @Override
  public int countCreatedSince(Connection conn, String userId, Instant since) {
    String sql = "SELECT COUNT(*) FROM insight_generation_job WHERE requested_by=? AND created_at >= ?";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), userId, timestamp(since));
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  private InsightGenerationJob mapRow(ResultSet rs) throws SQLException {
    return new InsightGenerationJob(
        rs.getString("id"),
        rs.getString("requested_by"),
        InsightJobStatus.valueOf(rs.getString("status")),
        rs.getString("queue"),
        rs.getString("task_name"),
        readPayload(rs.getString("payload")),
        instant(rs, "created_at"),
        instant(rs, "dispatched_at"),
        instant(rs, "completed_at"),
        rs.getString("insight_id"),
        rs.getString("error_code"),
        rs.getString("error_message"));
  }

  private String writePayload(InsightJobPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize insight job payload", e);
    }
  }

  private InsightJobPayload readPayload(String json) {
    try {
      return objectMapper.readValue(json, InsightJobPayload.class);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to parse insight job payload", e);
    }
  }
}
