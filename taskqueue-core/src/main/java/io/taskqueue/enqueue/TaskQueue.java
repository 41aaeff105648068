package io.taskqueue.enqueue;

import io.taskqueue.RetryConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A named queue with a fixed retry descriptor, bound to an enqueuer.
 *
 * <pre>{@code
 * TaskQueue notifications = new TaskQueue("notifications-dispatch", RetryConfig.of(5, 60, 900), enqueuer);
 * notifications.enqueue(payloadJson, EnqueueOptions.none().withDiscriminator(recipientId));
 * }</pre>
 */
public final class TaskQueue {
  private final String name;
  private final RetryConfig retryConfig;
  private final TaskEnqueuer enqueuer;

  public TaskQueue(String name, RetryConfig retryConfig, TaskEnqueuer enqueuer) {
    this.name = Objects.requireNonNull(name, "name");
    this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
    this.enqueuer = Objects.requireNonNull(enqueuer, "enqueuer");
  }

  public String name() {
    return name;
  }

  public RetryConfig retryConfig() {
    return retryConfig;
  }

  public String enqueue(String payloadJson, EnqueueOptions options) throws SQLException {
    return enqueuer.enqueue(name, payloadJson, bind(options));
  }

  public String enqueue(Connection conn, String payloadJson, EnqueueOptions options) {
    return enqueuer.enqueue(conn, name, payloadJson, bind(options));
  }

  private EnqueueOptions bind(EnqueueOptions options) {
    EnqueueOptions opts = options == null ? EnqueueOptions.none() : options;
    return opts.withRetryConfig(retryConfig);
  }
}
