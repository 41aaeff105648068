package io.taskqueue.jdbc.store;

import io.taskqueue.RetryConfig;
import io.taskqueue.enqueue.DuplicateTaskException;
import io.taskqueue.jdbc.JdbcTemplate;
import io.taskqueue.jdbc.TableNames;
import io.taskqueue.jdbc.TaskStoreException;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import io.taskqueue.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.taskqueue.jdbc.JdbcTemplate.instant;
import static io.taskqueue.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC task store with standard SQL implementations.
 *
 * <p>The default claim selects the earliest eligible row with {@link #lockClause()} and
 * then moves it to DISPATCHED with a {@code status='PENDING'} guard. Subclasses change the
 * lock clause or override {@link #claimNext} entirely. Register custom implementations via
 * {@code META-INF/services/io.taskqueue.jdbc.store.AbstractJdbcTaskStore}.
 *
 * @see JdbcTaskStores
 */
public abstract class AbstractJdbcTaskStore implements TaskStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS =
      "id, name, queue, status, payload, max_attempts, min_backoff_seconds, max_backoff_seconds, " +
      "schedule_time, attempt_count, first_attempt_at, last_attempt_at, error_message, job_id, " +
      "retry_of, created_at";

  /** Immediately eligible rows first, then by schedule time, then creation order. */
  protected static final String ELIGIBLE_ORDER =
      "CASE WHEN schedule_time IS NULL THEN 0 ELSE 1 END, schedule_time, id";

  protected static final String PENDING = "'" + TaskStatus.PENDING.name() + "'";
  protected static final String DISPATCHED = "'" + TaskStatus.DISPATCHED.name() + "'";
  protected static final String FAILED = "'" + TaskStatus.FAILED.name() + "'";

  protected static final JdbcTemplate.RowMapper<TaskRecord> TASK_ROW_MAPPER = rs -> new TaskRecord(
      rs.getLong("id"),
      rs.getString("name"),
      rs.getString("queue"),
      TaskStatus.valueOf(rs.getString("status")),
      rs.getString("payload"),
      RetryConfig.of(rs.getInt("max_attempts"),
          rs.getInt("min_backoff_seconds"), rs.getInt("max_backoff_seconds")),
      instant(rs, "schedule_time"),
      rs.getInt("attempt_count"),
      instant(rs, "first_attempt_at"),
      instant(rs, "last_attempt_at"),
      rs.getString("error_message"),
      rs.getString("job_id"),
      rs.getString("retry_of"),
      instant(rs, "created_at"));

  private final String tableName;

  protected AbstractJdbcTaskStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcTaskStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this task store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this task store handles (e.g., "jdbc:mysql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect that operates on another table.
   */
  public abstract AbstractJdbcTaskStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  /**
   * Row-lock suffix appended to the claim SELECT. Defaults to {@code FOR UPDATE}.
   */
  protected String lockClause() {
    return " FOR UPDATE";
  }

  @Override
  public void insert(Connection conn, NewTask task) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "name, queue, status, payload, max_attempts, min_backoff_seconds, max_backoff_seconds, " +
        "schedule_time, attempt_count, first_attempt_at, last_attempt_at, error_message, job_id, " +
        "retry_of, created_at" +
        ") VALUES (?,?," + PENDING + ",?,?,?,?,?,?,?,NULL,NULL,?,?,?)";
    RetryConfig retry = task.retryConfig();
    try {
      JdbcTemplate.update(conn, sql,
          task.name(), task.queue(), task.payloadJson(),
          retry.maxAttempts(), (int) retry.minBackoff().toSeconds(), (int) retry.maxBackoff().toSeconds(),
          timestamp(task.scheduleTime()), task.attemptCount(), timestamp(task.firstAttemptAt()),
          task.jobId(), task.retryOf(), timestamp(task.createdAt()));
    } catch (TaskStoreException e) {
      if (isUniqueViolation(e.getCause())) {
        throw new DuplicateTaskException(task.name(), e.getCause());
      }
      throw e;
    }
  }

  @Override
  public Optional<TaskRecord> findByName(Connection conn, String name) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE name=?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, name).stream().findFirst();
  }

  @Override
  public Optional<TaskRecord> claimNext(Connection conn, String queue, Instant now) {
    String selectSql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE queue=? AND status=" + PENDING +
        " AND (schedule_time IS NULL OR schedule_time <= ?)" +
        " ORDER BY " + ELIGIBLE_ORDER + " LIMIT 1" + lockClause();
    List<TaskRecord> candidates = JdbcTemplate.query(conn, selectSql, TASK_ROW_MAPPER,
        queue, timestamp(now));
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    TaskRecord candidate = candidates.get(0);
    String claimSql = "UPDATE " + tableName() + " SET status=" + DISPATCHED +
        " WHERE id=? AND status=" + PENDING;
    if (JdbcTemplate.update(conn, claimSql, candidate.id()) != 1) {
      return Optional.empty();
    }
    return Optional.of(dispatched(candidate));
  }

  @Override
  public int markSucceeded(Connection conn, String name, Instant attemptedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status='" + TaskStatus.SUCCEEDED.name() + "', attempt_count=attempt_count+1," +
        " first_attempt_at=COALESCE(first_attempt_at, ?), last_attempt_at=?, error_message=NULL" +
        " WHERE name=? AND status=" + DISPATCHED;
    return JdbcTemplate.update(conn, sql, timestamp(attemptedAt), timestamp(attemptedAt), name);
  }

  @Override
  public int markFailed(Connection conn, String name, Instant attemptedAt, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + FAILED + ", attempt_count=attempt_count+1," +
        " first_attempt_at=COALESCE(first_attempt_at, ?), last_attempt_at=?, error_message=?" +
        " WHERE name=? AND status=" + DISPATCHED;
    return JdbcTemplate.update(conn, sql, timestamp(attemptedAt), timestamp(attemptedAt),
        truncateError(error), name);
  }

  @Override
  public int count(Connection conn, String queue, TaskStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE queue=? AND status=?";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), queue, status.name());
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public List<TaskRecord> findFailed(Connection conn, String queue, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE queue=? AND status=" + FAILED + " ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, queue, limit);
  }

  @Override
  public List<TaskRecord> findRequeueCandidates(Connection conn, String queue, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " f" +
        " WHERE f.queue=? AND f.status=" + FAILED + " AND f.attempt_count < f.max_attempts" +
        " AND NOT EXISTS (SELECT 1 FROM " + tableName() + " s WHERE s.retry_of = f.name)" +
        " ORDER BY f.id LIMIT ?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, queue, limit);
  }

  protected static TaskRecord dispatched(TaskRecord row) {
    return new TaskRecord(row.id(), row.name(), row.queue(), TaskStatus.DISPATCHED,
        row.payloadJson(), row.retryConfig(), row.scheduleTime(), row.attemptCount(),
        row.firstAttemptAt(), row.lastAttemptAt(), row.errorMessage(), row.jobId(),
        row.retryOf(), row.createdAt());
  }

  /**
   * Unique-key violation: SQLState 23505 (H2, PostgreSQL) or MySQL error 1062.
   */
  protected boolean isUniqueViolation(Throwable cause) {
    if (!(cause instanceof SQLException e)) {
      return false;
    }
    return "23505".equals(e.getSQLState()) || e.getErrorCode() == 1062;
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
