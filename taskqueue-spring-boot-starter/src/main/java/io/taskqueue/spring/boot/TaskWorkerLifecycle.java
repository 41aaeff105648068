package io.taskqueue.spring.boot;

import io.taskqueue.runner.TaskWorkerPool;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Objects;

/**
 * Starts the {@link TaskWorkerPool} with the application context and drains it when the
 * context stops. A stopped context can be started again; the pool itself is closed by its
 * bean destroy method.
 */
public class TaskWorkerLifecycle implements SmartLifecycle {

  private final TaskWorkerPool pool;
  private volatile boolean running;

  public TaskWorkerLifecycle(TaskWorkerPool pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  @Override
  public void start() {
    pool.start();
    running = true;
  }

  /**
   * Blocks for up to the configured drain timeout while in-flight handlers finish.
   */
  @Override
  public void stop() {
    running = false;
    pool.stop();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public List<String> runningQueues() {
    return pool.runningQueues();
  }
}
