package io.taskqueue.jdbc.store;

import io.taskqueue.jdbc.JdbcTemplate;
import io.taskqueue.model.TaskRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.taskqueue.jdbc.JdbcTemplate.timestamp;

/**
 * PostgreSQL task store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim; the returned row count is the proof of ownership.
 */
public final class PostgresTaskStore extends AbstractJdbcTaskStore {

  public PostgresTaskStore() {
    super();
  }

  public PostgresTaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcTaskStore withTableName(String tableName) {
    return new PostgresTaskStore(tableName);
  }

  @Override
  protected String lockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }

  @Override
  public Optional<TaskRecord> claimNext(Connection conn, String queue, Instant now) {
    String sql = "UPDATE " + tableName() + " SET status=" + DISPATCHED +
        " WHERE id = (" +
        "SELECT id FROM " + tableName() +
        " WHERE queue=? AND status=" + PENDING +
        " AND (schedule_time IS NULL OR schedule_time <= ?)" +
        " ORDER BY " + ELIGIBLE_ORDER + " LIMIT 1" + lockClause() +
        ") AND status=" + PENDING +
        " RETURNING " + COLUMNS;
    List<TaskRecord> claimed = JdbcTemplate.updateReturning(conn, sql, TASK_ROW_MAPPER,
        queue, timestamp(now));
    return claimed.stream().findFirst();
  }
}
