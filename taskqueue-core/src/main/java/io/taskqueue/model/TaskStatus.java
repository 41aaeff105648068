package io.taskqueue.model;

/**
 * Lifecycle status of a Task Record.
 *
 * <p>Transitions are strictly {@code PENDING -> DISPATCHED -> (SUCCEEDED | FAILED)}.
 * Terminal tasks are never moved back; a retry is a new task.
 */
public enum TaskStatus {
  PENDING,
  DISPATCHED,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
