package io.taskqueue.runner;

import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.MetricsExporter;
import io.taskqueue.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polling loop for one queue, running on its own daemon thread named
 * {@code taskqueue-worker-<queue>}.
 *
 * <p>Each cycle claims at most one task (see {@link TaskStore#claimNext}) and invokes the
 * queue's {@link TaskHandler}:
 * <ul>
 *   <li>{@link DispatchResult.Succeeded}: task marked SUCCEEDED, next cycle starts at once.</li>
 *   <li>{@link DispatchResult.Failed}: task marked FAILED with the reason.</li>
 *   <li>{@link DispatchResult.Handled}: the handler owns the record; nothing is written.</li>
 *   <li>Exception or {@link Error}: task marked FAILED with its message, then the runner
 *       waits {@code errorBackoff}. A {@link VirtualMachineError} is recorded and then
 *       rethrown.</li>
 * </ul>
 * An empty claim (or a claim the store could not complete) waits {@code pollInterval}.
 *
 * <p>{@link #close()} stops new claims and wakes a sleeping loop. A handler that is
 * already running is never interrupted; {@code close()} waits up to {@code drainTimeout}
 * for it and then returns.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see TaskWorkerPool
 */
public final class WorkerRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerRunner.class.getName());

  /**
   * Outcome of a single {@link #runOnce()} cycle.
   */
  public enum Cycle {
    /** Nothing was claimed. */
    IDLE,
    /** A task was claimed and the handler returned a result. */
    COMPLETED,
    /** A task was claimed and the handler threw. */
    ERRORED
  }

  private final String queue;
  private final TaskHandler handler;
  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final Duration pollInterval;
  private final Duration errorBackoff;
  private final Duration drainTimeout;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private volatile boolean stopping;
  private volatile String inFlightTask;
  private Thread thread;

  private WorkerRunner(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.errorBackoff = Objects.requireNonNull(builder.errorBackoff, "errorBackoff");
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");

    if (queue.isBlank()) {
      throw new IllegalArgumentException("queue must not be blank");
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (errorBackoff.isNegative() || errorBackoff.isZero()) {
      throw new IllegalArgumentException("errorBackoff must be positive");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String queue() {
    return queue;
  }

  /**
   * Name of the task whose handler is currently running, or {@code null}.
   */
  public String inFlightTask() {
    return inFlightTask;
  }

  public synchronized boolean isRunning() {
    return thread != null && thread.isAlive();
  }

  /**
   * Starts the polling thread. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the runner has been closed
   */
  public synchronized void start() {
    if (stopping) {
      throw new IllegalStateException("WorkerRunner for queue " + queue + " has been closed");
    }
    if (thread != null) {
      return;
    }
    thread = new Thread(this::loop, "taskqueue-worker-" + queue);
    thread.setDaemon(true);
    thread.start();
    logger.info("Worker started for queue " + queue);
  }

  private void loop() {
    while (!stopping) {
      Cycle cycle;
      try {
        cycle = runOnce();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Worker loop error on queue " + queue, t);
        cycle = Cycle.ERRORED;
      }
      if (cycle == Cycle.IDLE) {
        pause(pollInterval);
      } else if (cycle == Cycle.ERRORED) {
        pause(errorBackoff);
      }
    }
    logger.info("Worker stopped for queue " + queue);
  }

  /**
   * Executes a single claim-and-dispatch cycle on the calling thread. Called by the
   * polling thread, but may also be invoked directly for testing.
   *
   * @return what the cycle did; {@link Cycle#IDLE} once the runner is stopping
   */
  public Cycle runOnce() {
    if (stopping) {
      return Cycle.IDLE;
    }
    Optional<TaskRecord> claimed = claim();
    if (claimed.isEmpty()) {
      metrics.incrementIdlePolls(queue);
      return Cycle.IDLE;
    }
    metrics.incrementClaimed(queue);
    return dispatch(claimed.get());
  }

  private Optional<TaskRecord> claim() {
    try (Connection conn = connectionProvider.getConnection()) {
      // lock + conditional update must share one transaction
      conn.setAutoCommit(false);
      try {
        Optional<TaskRecord> claimed = taskStore.claimNext(conn, queue, clock.instant());
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim task on queue " + queue, e);
      return Optional.empty();
    }
  }

  private Cycle dispatch(TaskRecord task) {
    inFlightTask = task.name();
    long startNanos = System.nanoTime();
    try {
      DispatchResult result = handler.handle(task.name());
      if (result == null) {
        throw new IllegalStateException("Handler for queue " + queue + " returned no result");
      }
      recordResult(task, result);
      return Cycle.COMPLETED;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Handler failed for task " + task.name() + " on queue " + queue, t);
      metrics.incrementRunnerFailures(queue);
      markFailed(task, describe(t));
      if (t instanceof VirtualMachineError vmError) {
        throw vmError;
      }
      return Cycle.ERRORED;
    } finally {
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      metrics.recordHandlerDurationMs(queue, Math.max(0L, elapsedMs));
      inFlightTask = null;
    }
  }

  private void recordResult(TaskRecord task, DispatchResult result) {
    if (result instanceof DispatchResult.Succeeded) {
      metrics.incrementSucceeded(queue);
      updateTask(task.name(), "mark SUCCEEDED",
          conn -> taskStore.markSucceeded(conn, task.name(), clock.instant()));
    } else if (result instanceof DispatchResult.Failed failed) {
      metrics.incrementFailed(queue);
      markFailed(task, failed.reason());
    } else if (logger.isLoggable(Level.FINE)) {
      logger.fine("Task " + task.name() + " outcome recorded by its handler");
    }
  }

  private void markFailed(TaskRecord task, String error) {
    int attempts = task.attemptCount() + 1;
    if (task.retryConfig().isExhausted(attempts)) {
      metrics.incrementExhausted(queue);
      logger.log(Level.WARNING, "Task " + task.name() + " failed on its final attempt ("
          + attempts + " of " + task.retryConfig().maxAttempts() + "): " + error);
    }
    updateTask(task.name(), "mark FAILED",
        conn -> taskStore.markFailed(conn, task.name(), clock.instant(), error));
  }

  private void updateTask(String taskName, String action, StatusUpdate update) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (update.apply(conn) == 0) {
        logger.log(Level.WARNING, "Task " + taskName + " is no longer DISPATCHED; skipped " + action);
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for task " + taskName, e);
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null || message.isBlank() ? failure.getClass().getName() : message;
  }

  private void pause(Duration duration) {
    try {
      stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stopping = true;
    }
  }

  /**
   * Stops new claims and wakes the loop if it is sleeping. Does not wait.
   */
  public void requestStop() {
    stopping = true;
    stopSignal.countDown();
  }

  /**
   * Waits for the polling thread to exit.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the thread has exited (or was never started)
   */
  public boolean awaitTermination(Duration timeout) {
    Thread current;
    synchronized (this) {
      current = thread;
    }
    if (current == null) {
      return true;
    }
    try {
      current.join(Math.max(1L, timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return !current.isAlive();
  }

  /**
   * Stops the runner and waits up to {@code drainTimeout} for an in-flight handler.
   */
  @Override
  public void close() {
    requestStop();
    if (!awaitTermination(drainTimeout)) {
      logger.log(Level.WARNING, "Drain timeout exceeded on queue " + queue
          + "; handler still running for task " + inFlightTask);
    }
  }

  @FunctionalInterface
  private interface StatusUpdate {
    int apply(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link WorkerRunner}.
   */
  public static final class Builder {
    private String queue;
    private TaskHandler handler;
    private ConnectionProvider connectionProvider;
    private TaskStore taskStore;
    private Duration pollInterval = RunnerConfig.DEFAULT_POLL_INTERVAL;
    private Duration errorBackoff = RunnerConfig.DEFAULT_ERROR_BACKOFF;
    private Duration drainTimeout = RunnerConfig.DEFAULT_DRAIN_TIMEOUT;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the queue this runner claims from.
     *
     * <p><b>Required.</b>
     *
     * @param queue the queue name
     * @return this builder
     */
    public Builder queue(String queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the handler invoked for every claimed task.
     *
     * <p><b>Required.</b>
     *
     * @param handler the queue's handler
     * @return this builder
     */
    public Builder handler(TaskHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the connection provider for claims and status updates.
     *
     * <p><b>Required.</b>
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
     * Sets the wait after an idle poll cycle.
     *
     * <p>Optional. Defaults to 5 seconds. Must be positive.
     *
     * @param pollInterval idle wait
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets the wait after a handler threw.
     *
     * <p>Optional. Defaults to 2 seconds. Must be positive.
     *
     * @param errorBackoff wait after a runner-level failure
     * @return this builder
     */
    public Builder errorBackoff(Duration errorBackoff) {
      this.errorBackoff = errorBackoff;
      return this;
    }

    /**
     * Sets how long {@link WorkerRunner#close()} waits for an in-flight handler.
     *
     * <p>Optional. Defaults to 30 seconds. Must be &ge; 0.
     *
     * @param drainTimeout drain wait
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for claim eligibility and attempt timestamps.
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
     * Builds the runner. Call {@link WorkerRunner#start()} to begin polling.
     *
     * @return a new {@link WorkerRunner}
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a timing is out of range
     */
    public WorkerRunner build() {
      return new WorkerRunner(this);
    }
  }
}
