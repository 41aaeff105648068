package io.taskqueue;

import io.taskqueue.model.TaskRecord;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Read access to Task Records by name, used by handlers to load payloads and attempt
 * bookkeeping for the task they were invoked with.
 *
 * @see StoreTaskLookup
 */
@FunctionalInterface
public interface TaskLookup {

  /**
   * Finds a task by its unique name.
   *
   * @param taskName the task name
   * @return the task, or empty if no such task exists
   * @throws SQLException if a connection cannot be obtained
   */
  Optional<TaskRecord> find(String taskName) throws SQLException;
}
