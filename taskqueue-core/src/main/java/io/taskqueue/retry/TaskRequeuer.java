package io.taskqueue.retry;

import io.taskqueue.enqueue.DuplicateTaskException;
import io.taskqueue.enqueue.TaskNames;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Producer-side facade for re-queueing and inspecting FAILED tasks.
 *
 * <p>The worker runner never re-dispatches a failed task. Instead this facade inserts a
 * successor PENDING task named {@code <name>.retry<attempts>} that carries the failed
 * task's payload, job id, retry descriptor, attempt count and first attempt time, and is
 * scheduled after the descriptor's backoff. The failed task itself stays FAILED.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see TaskStore#findRequeueCandidates
 */
public final class TaskRequeuer {
  private static final Logger logger = Logger.getLogger(TaskRequeuer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final Clock clock;

  public TaskRequeuer(ConnectionProvider connectionProvider, TaskStore taskStore) {
    this(connectionProvider, taskStore, Clock.systemUTC());
  }

  public TaskRequeuer(ConnectionProvider connectionProvider, TaskStore taskStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Re-queues up to {@code limit} FAILED tasks of a queue that still have attempts left.
   *
   * @param queue the queue name
   * @param limit maximum number of successors to create
   * @return number of successor tasks inserted
   */
  public int requeueFailed(String queue, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    int requeued = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<TaskRecord> candidates = taskStore.findRequeueCandidates(conn, queue, limit);
      Instant now = clock.instant();
      for (TaskRecord failed : candidates) {
        if (insertSuccessor(conn, failed, now)) {
          requeued++;
        }
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to re-queue failed tasks for queue " + queue, e);
    }
    return requeued;
  }

  private boolean insertSuccessor(Connection conn, TaskRecord failed, Instant now) {
    int attempts = failed.attemptCount();
    NewTask successor = new NewTask(
        TaskNames.retryOf(failed.name(), attempts),
        failed.queue(),
        failed.payloadJson(),
        failed.retryConfig(),
        now.plus(failed.retryConfig().backoffFor(attempts)),
        failed.jobId(),
        failed.name(),
        attempts,
        failed.firstAttemptAt(),
        now);
    try {
      taskStore.insert(conn, successor);
      logger.info("Re-queued task " + failed.name() + " as " + successor.name()
          + " (attempt " + (attempts + 1) + " of " + failed.retryConfig().maxAttempts() + ")");
      return true;
    } catch (DuplicateTaskException e) {
      logger.log(Level.FINE, "Successor already exists for task " + failed.name(), e);
      return false;
    }
  }

  /**
   * Lists FAILED tasks of a queue, oldest first.
   *
   * @return failed tasks, or an empty list if the store could not be reached
   */
  public List<TaskRecord> findFailed(String queue, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.findFailed(conn, queue, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query failed tasks for queue " + queue, e);
      return List.of();
    }
  }

  /**
   * Counts tasks of a queue in a given status.
   *
   * @return the count, or {@code 0} if the store could not be reached
   */
  public int count(String queue, TaskStatus status) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.count(conn, queue, status);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count " + status + " tasks for queue " + queue, e);
      return 0;
    }
  }
}
