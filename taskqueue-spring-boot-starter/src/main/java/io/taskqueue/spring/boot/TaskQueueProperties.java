package io.taskqueue.spring.boot;

import io.taskqueue.RetryConfig;
import io.taskqueue.jdbc.TableNames;
import io.taskqueue.runner.RunnerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for task queue workers.
 *
 * @see TaskQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "taskqueue")
public class TaskQueueProperties {

  /**
   * Database table name for task records.
   */
  private String tableName = TableNames.DEFAULT_TABLE;

  private final Worker worker = new Worker();
  private final Retry retry = new Retry();
  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public Worker getWorker() {
    return worker;
  }

  public Retry getRetry() {
    return retry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Worker {
    /**
     * Whether this process runs workers. Enqueue-only services set this to false.
     */
    private boolean enabled = true;
    /**
     * Queues to serve. Empty means every queue with a registered handler.
     */
    private List<String> queues = new ArrayList<>();
    private Duration pollInterval = RunnerConfig.DEFAULT_POLL_INTERVAL;
    private Duration errorBackoff = RunnerConfig.DEFAULT_ERROR_BACKOFF;
    private Duration drainTimeout = RunnerConfig.DEFAULT_DRAIN_TIMEOUT;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public List<String> getQueues() {
      return queues;
    }

    public void setQueues(List<String> queues) {
      this.queues = queues;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getErrorBackoff() {
      return errorBackoff;
    }

    public void setErrorBackoff(Duration errorBackoff) {
      this.errorBackoff = errorBackoff;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }

    RunnerConfig toRunnerConfig() {
      List<String> names = queues.stream()
          .map(String::trim)
          .filter(q -> !q.isEmpty())
          .distinct()
          .toList();
      return new RunnerConfig(names, pollInterval, errorBackoff, drainTimeout);
    }
  }

  /**
   * Retry descriptor applied to tasks enqueued without one.
   */
  public static class Retry {
    private int maxAttempts = RetryConfig.DEFAULT.maxAttempts();
    private Duration minBackoff = RetryConfig.DEFAULT.minBackoff();
    private Duration maxBackoff = RetryConfig.DEFAULT.maxBackoff();

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getMinBackoff() {
      return minBackoff;
    }

    public void setMinBackoff(Duration minBackoff) {
      this.minBackoff = minBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    RetryConfig toRetryConfig() {
      return new RetryConfig(maxAttempts, minBackoff, maxBackoff);
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "taskqueue";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
