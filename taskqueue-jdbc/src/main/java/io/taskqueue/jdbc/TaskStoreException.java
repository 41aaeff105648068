package io.taskqueue.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC task stores and
 * {@link JdbcTemplate}.
 */
public final class TaskStoreException extends RuntimeException {
  public TaskStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
