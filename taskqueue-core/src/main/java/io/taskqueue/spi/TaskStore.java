package io.taskqueue.spi;

import io.taskqueue.enqueue.DuplicateTaskException;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for Task Records.
 *
 * <p>All methods operate on a caller-supplied {@link Connection}; the store never opens,
 * commits or closes connections itself. Status-changing updates are guarded by the
 * expected current status, so a terminal task is never moved back.
 */
public interface TaskStore {

  /**
   * Inserts a new PENDING task.
   *
   * @param conn the JDBC connection (may belong to a caller transaction)
   * @param task the task to insert
   * @throws DuplicateTaskException if a task with the same name already exists
   */
  void insert(Connection conn, NewTask task);

  /**
   * Looks up a task by its unique name.
   */
  Optional<TaskRecord> findByName(Connection conn, String name);

  /**
   * Claims the earliest eligible PENDING task of a queue and moves it to DISPATCHED.
   *
   * <p>Must run inside a transaction (auto-commit off). The candidate row is locked and
   * then updated with a {@code status='PENDING'} guard; only an update count of one
   * counts as a claim. A lost race returns empty.
   *
   * @param conn  the JDBC connection, with auto-commit disabled
   * @param queue the queue name
   * @param now   eligibility cut-off for {@code schedule_time}
   * @return the claimed task in DISPATCHED status, or empty
   */
  Optional<TaskRecord> claimNext(Connection conn, String queue, Instant now);

  /**
   * Marks a DISPATCHED task SUCCEEDED, incrementing its attempt count and clearing the error.
   *
   * @return rows updated (0 if the task is not DISPATCHED)
   */
  int markSucceeded(Connection conn, String name, Instant attemptedAt);

  /**
   * Marks a DISPATCHED task FAILED, incrementing its attempt count and storing the error.
   *
   * @return rows updated (0 if the task is not DISPATCHED)
   */
  int markFailed(Connection conn, String name, Instant attemptedAt, String error);

  /**
   * Counts tasks of a queue in the given status.
   */
  int count(Connection conn, String queue, TaskStatus status);

  /**
   * Lists FAILED tasks of a queue, oldest first.
   */
  List<TaskRecord> findFailed(Connection conn, String queue, int limit);

  /**
   * Lists FAILED tasks of a queue that still have attempts left and have not been
   * re-queued yet (no task names them in {@code retryOf}), oldest first.
   */
  List<TaskRecord> findRequeueCandidates(Connection conn, String queue, int limit);
}
