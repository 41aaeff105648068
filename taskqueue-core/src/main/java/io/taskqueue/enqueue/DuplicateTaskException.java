package io.taskqueue.enqueue;

/**
 * Thrown when a task is enqueued under a name that already exists.
 *
 * <p>Task names are unique across all queues and are never silently deduplicated: a
 * producer that reuses a name has either already enqueued that work or chose a colliding
 * name, and must decide which.
 */
public final class DuplicateTaskException extends RuntimeException {
  private final String taskName;

  public DuplicateTaskException(String taskName, Throwable cause) {
    super("Task already exists: " + taskName, cause);
    this.taskName = taskName;
  }

  public String taskName() {
    return taskName;
  }
}
