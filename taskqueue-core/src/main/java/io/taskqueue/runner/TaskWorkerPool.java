package io.taskqueue.runner;

import io.taskqueue.TaskHandler;
import io.taskqueue.registry.HandlerRegistry;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.MetricsExporter;
import io.taskqueue.spi.TaskStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts one {@link WorkerRunner} per configured queue.
 *
 * <p>Queues come from {@link RunnerConfig#queues()}, or from every queue in the
 * {@link HandlerRegistry} when that list is empty. A configured queue without a
 * registered handler is logged and skipped; if no queue is runnable the pool starts
 * nothing. Runners share only the store and the connection provider, so a slow handler
 * on one queue never delays another queue.
 *
 * <p>{@link #stop()} and {@link #close()} signal every runner first and then wait for all of
 * them against a single {@code drainTimeout} deadline. After {@code stop()} the pool may be
 * started again with new runners; after {@code close()} it may not.
 */
public final class TaskWorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TaskWorkerPool.class.getName());

  private final HandlerRegistry handlerRegistry;
  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final RunnerConfig config;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final List<WorkerRunner> runners = new ArrayList<>();
  private boolean started;
  private boolean closed;

  private TaskWorkerPool(Builder builder) {
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.config = builder.config != null ? builder.config : RunnerConfig.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a runner for every runnable queue. Subsequent calls are no-ops until
   * {@link #stop()}; a stopped pool starts fresh runners.
   *
   * @throws IllegalStateException if the pool has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("TaskWorkerPool has been closed");
    }
    if (started) {
      return;
    }
    started = true;

    Collection<String> requested = config.queues().isEmpty() ? handlerRegistry.queues() : config.queues();
    for (String queue : requested) {
      TaskHandler handler = handlerRegistry.handlerFor(queue);
      if (handler == null) {
        logger.log(Level.WARNING, "No handler registered for queue " + queue + "; skipping");
        continue;
      }
      runners.add(WorkerRunner.builder()
          .queue(queue)
          .handler(handler)
          .connectionProvider(connectionProvider)
          .taskStore(taskStore)
          .pollInterval(config.pollInterval())
          .errorBackoff(config.errorBackoff())
          .drainTimeout(config.drainTimeout())
          .metrics(metrics)
          .clock(clock)
          .build());
    }

    if (runners.isEmpty()) {
      logger.log(Level.WARNING, "No runnable queues among " + requested + "; no workers started");
      return;
    }
    runners.forEach(WorkerRunner::start);
    logger.info("Started workers for queues " + runningQueues());
  }

  public synchronized boolean isStarted() {
    return started;
  }

  /**
   * Queues that have a runner, in start order.
   */
  public synchronized List<String> runningQueues() {
    return runners.stream().map(WorkerRunner::queue).toList();
  }

  /**
   * Drains the current runners and discards them. The pool can be started again.
   */
  public synchronized void stop() {
    if (!started) {
      return;
    }
    drain();
    runners.clear();
    started = false;
  }

  /**
   * Stops all runners and waits up to {@code drainTimeout} for in-flight handlers. A closed
   * pool cannot be started again.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    stop();
  }

  private void drain() {
    runners.forEach(WorkerRunner::requestStop);

    long deadline = System.nanoTime() + config.drainTimeout().toNanos();
    List<String> busy = new ArrayList<>();
    for (WorkerRunner runner : runners) {
      Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
      if (!runner.awaitTermination(remaining)) {
        busy.add(runner.queue() + "=" + runner.inFlightTask());
      }
    }
    if (!busy.isEmpty()) {
      logger.log(Level.WARNING, "Drain timeout exceeded; handlers still running: " + busy);
    }
  }

  /**
   * Builder for {@link TaskWorkerPool}.
   */
  public static final class Builder {
    private HandlerRegistry handlerRegistry;
    private ConnectionProvider connectionProvider;
    private TaskStore taskStore;
    private RunnerConfig config;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> Source of queue handlers. */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /** <b>Required.</b> Connections for claims and status updates. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Task persistence. */
    public Builder taskStore(TaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /** Optional. Defaults to {@link RunnerConfig#defaults()}. */
    public Builder config(RunnerConfig config) {
      this.config = config;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public TaskWorkerPool build() {
      return new TaskWorkerPool(this);
    }
  }
}
