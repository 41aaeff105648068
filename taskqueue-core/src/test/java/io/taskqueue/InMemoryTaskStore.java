package io.taskqueue;

import io.taskqueue.enqueue.DuplicateTaskException;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.TaskStore;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task store that keeps records in memory and ignores the connection argument.
 */
public class InMemoryTaskStore implements TaskStore {
  private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  public static ConnectionProvider dummyConnections() {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  @Override
  public synchronized void insert(Connection conn, NewTask task) {
    if (tasks.containsKey(task.name())) {
      throw new DuplicateTaskException(task.name(), null);
    }
    tasks.put(task.name(), new TaskRecord(sequence.incrementAndGet(), task.name(), task.queue(),
        TaskStatus.PENDING, task.payloadJson(), task.retryConfig(), task.scheduleTime(),
        task.attemptCount(), task.firstAttemptAt(), null, null, task.jobId(), task.retryOf(),
        task.createdAt()));
  }

  @Override
  public synchronized Optional<TaskRecord> findByName(Connection conn, String name) {
    return Optional.ofNullable(tasks.get(name));
  }

  @Override
  public synchronized Optional<TaskRecord> claimNext(Connection conn, String queue, Instant now) {
    Optional<TaskRecord> next = tasks.values().stream()
        .filter(t -> t.queue().equals(queue) && t.isEligibleAt(now))
        .min(Comparator.comparing((TaskRecord t) -> t.scheduleTime() == null ? Instant.MIN : t.scheduleTime())
            .thenComparingLong(TaskRecord::id));
    next.ifPresent(t -> tasks.put(t.name(), withStatus(t, TaskStatus.DISPATCHED, t.attemptCount(),
        t.firstAttemptAt(), t.lastAttemptAt(), t.errorMessage())));
    return next.map(t -> tasks.get(t.name()));
  }

  @Override
  public synchronized int markSucceeded(Connection conn, String name, Instant attemptedAt) {
    return complete(name, TaskStatus.SUCCEEDED, attemptedAt, null);
  }

  @Override
  public synchronized int markFailed(Connection conn, String name, Instant attemptedAt, String error) {
    return complete(name, TaskStatus.FAILED, attemptedAt, error);
  }

  private int complete(String name, TaskStatus status, Instant at, String error) {
    TaskRecord t = tasks.get(name);
    if (t == null || t.status() != TaskStatus.DISPATCHED) {
      return 0;
    }
    tasks.put(name, withStatus(t, status, t.attemptCount() + 1,
        t.firstAttemptAt() != null ? t.firstAttemptAt() : at, at, error));
    return 1;
  }

  @Override
  public synchronized int count(Connection conn, String queue, TaskStatus status) {
    return (int) tasks.values().stream()
        .filter(t -> t.queue().equals(queue) && t.status() == status)
        .count();
  }

  @Override
  public synchronized List<TaskRecord> findFailed(Connection conn, String queue, int limit) {
    return tasks.values().stream()
        .filter(t -> t.queue().equals(queue) && t.status() == TaskStatus.FAILED)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<TaskRecord> findRequeueCandidates(Connection conn, String queue, int limit) {
    List<TaskRecord> result = new ArrayList<>();
    for (TaskRecord t : tasks.values()) {
      boolean requeued = tasks.values().stream().anyMatch(s -> t.name().equals(s.retryOf()));
      if (t.queue().equals(queue) && t.status() == TaskStatus.FAILED && !t.isExhausted() && !requeued) {
        result.add(t);
      }
      if (result.size() == limit) {
        break;
      }
    }
    return result;
  }

  public synchronized TaskRecord get(String name) {
    return tasks.get(name);
  }

  public synchronized List<TaskRecord> all() {
    return List.copyOf(tasks.values());
  }

  private static TaskRecord withStatus(TaskRecord t, TaskStatus status, int attempts,
      Instant first, Instant last, String error) {
    return new TaskRecord(t.id(), t.name(), t.queue(), status, t.payloadJson(), t.retryConfig(),
        t.scheduleTime(), attempts, first, last, error, t.jobId(), t.retryOf(), t.createdAt());
  }
}
