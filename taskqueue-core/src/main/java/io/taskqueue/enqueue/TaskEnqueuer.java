package io.taskqueue.enqueue;

import io.taskqueue.RetryConfig;
import io.taskqueue.model.NewTask;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Producer-side entry point: inserts one PENDING Task Record per call.
 *
 * <p>Two modes:
 * <ul>
 *   <li>{@link #enqueue(Connection, String, String, EnqueueOptions)} joins the caller's
 *       transaction, so a producer can create its Domain Job Record and the task
 *       atomically.</li>
 *   <li>{@link #enqueue(String, String, EnqueueOptions)} takes its own auto-commit
 *       connection from the {@link ConnectionProvider}.</li>
 * </ul>
 *
 * <p>The payload is stored as given; it is the handler's job to validate it.
 *
 * @see TaskQueue
 */
public final class TaskEnqueuer {
  private static final Logger logger = Logger.getLogger(TaskEnqueuer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final RetryConfig defaultRetryConfig;
  private final Clock clock;

  private TaskEnqueuer(Builder builder) {
    this.connectionProvider = builder.connectionProvider;
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.defaultRetryConfig = builder.defaultRetryConfig != null
        ? builder.defaultRetryConfig : RetryConfig.DEFAULT;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Enqueues a task on its own auto-commit connection.
   *
   * @return the name of the inserted task
   * @throws SQLException           if a connection cannot be obtained
   * @throws DuplicateTaskException if the task name is already taken
   * @throws IllegalStateException  if no connection provider was configured
   */
  public String enqueue(String queue, String payloadJson, EnqueueOptions options) throws SQLException {
    if (connectionProvider == null) {
      throw new IllegalStateException("No ConnectionProvider configured; pass a Connection instead");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return enqueue(conn, queue, payloadJson, options);
    }
  }

  /**
   * Enqueues a task within the caller's connection and transaction.
   *
   * @return the name of the inserted task
   * @throws DuplicateTaskException if the task name is already taken
   */
  public String enqueue(Connection conn, String queue, String payloadJson, EnqueueOptions options) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(payloadJson, "payloadJson");
    EnqueueOptions opts = options == null ? EnqueueOptions.none() : options;

    Instant now = clock.instant();
    String name = opts.taskName() != null
        ? opts.taskName()
        : TaskNames.generate(queue, opts.discriminator(), now);
    RetryConfig retryConfig = opts.retryConfig() != null ? opts.retryConfig() : defaultRetryConfig;

    taskStore.insert(conn, NewTask.fresh(
        name, queue, payloadJson, retryConfig, opts.scheduleTime(), opts.jobId(), now));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Enqueued task " + name + " on queue " + queue);
    }
    return name;
  }

  /**
   * Builder for {@link TaskEnqueuer}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TaskStore taskStore;
    private RetryConfig defaultRetryConfig;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the connection provider used by the connection-less {@code enqueue} overload.
     *
     * <p>Optional. Without one only the {@link Connection}-taking overload is usable.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the task store.
     *
     * <p><b>Required.</b>
     *
     * @param taskStore the persistence backend
     * @return this builder
     */
    public Builder taskStore(TaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /**
     * Sets the retry descriptor used when the options carry none.
     *
     * <p>Optional. Defaults to {@link RetryConfig#DEFAULT}.
     *
     * @param defaultRetryConfig the fallback retry descriptor
     * @return this builder
     */
    public Builder defaultRetryConfig(RetryConfig defaultRetryConfig) {
      this.defaultRetryConfig = defaultRetryConfig;
      return this;
    }

    /**
     * Sets the clock used for creation timestamps and generated names.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code taskStore} is null
     */
    public TaskEnqueuer build() {
      return new TaskEnqueuer(this);
    }
  }
}
