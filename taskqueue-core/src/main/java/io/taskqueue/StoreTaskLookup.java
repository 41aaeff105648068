package io.taskqueue;

import io.taskqueue.model.TaskRecord;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TaskLookup} that opens a short auto-commit connection per lookup.
 */
public final class StoreTaskLookup implements TaskLookup {
  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;

  public StoreTaskLookup(ConnectionProvider connectionProvider, TaskStore taskStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
  }

  @Override
  public Optional<TaskRecord> find(String taskName) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return taskStore.findByName(conn, taskName);
    }
  }
}
