package io.taskqueue.spring.boot;

import io.taskqueue.StoreTaskLookup;
import io.taskqueue.TaskLookup;
import io.taskqueue.alert.AlertingHook;
import io.taskqueue.alert.LoggingAlertingHook;
import io.taskqueue.enqueue.TaskEnqueuer;
import io.taskqueue.jdbc.TableNames;
import io.taskqueue.jdbc.store.AbstractJdbcTaskStore;
import io.taskqueue.jdbc.store.JdbcTaskStores;
import io.taskqueue.registry.DefaultHandlerRegistry;
import io.taskqueue.retry.TaskRequeuer;
import io.taskqueue.runner.TaskWorkerPool;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the task queue.
 *
 * <p>Always wires the enqueue side ({@link TaskEnqueuer}, {@link TaskRequeuer},
 * {@link TaskLookup}). Worker runners for every {@link TaskQueueHandler} bean start with
 * the context unless {@code taskqueue.worker.enabled=false}.
 *
 * @see TaskQueueProperties
 * @see TaskQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TaskWorkerPool.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TaskQueueProperties.class)
public class TaskQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcTaskStore taskStore(DataSource dataSource, TaskQueueProperties props) {
    AbstractJdbcTaskStore detected = JdbcTaskStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.isDefault(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider taskConnectionProvider(DataSource dataSource) {
    return ConnectionProvider.fromDataSource(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskHandlerRegistrar taskHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry) {
    return new TaskHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskEnqueuer taskEnqueuer(ConnectionProvider connectionProvider, AbstractJdbcTaskStore taskStore,
      TaskQueueProperties props) {
    return TaskEnqueuer.builder()
        .connectionProvider(connectionProvider)
        .taskStore(taskStore)
        .defaultRetryConfig(props.getRetry().toRetryConfig())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskRequeuer taskRequeuer(ConnectionProvider connectionProvider, AbstractJdbcTaskStore taskStore) {
    return new TaskRequeuer(connectionProvider, taskStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskLookup taskLookup(ConnectionProvider connectionProvider, AbstractJdbcTaskStore taskStore) {
    return new StoreTaskLookup(connectionProvider, taskStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public AlertingHook alertingHook() {
    return new LoggingAlertingHook();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "taskqueue.worker", name = "enabled", matchIfMissing = true)
  public TaskWorkerPool taskWorkerPool(TaskQueueProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcTaskStore taskStore,
      DefaultHandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider) {
    TaskWorkerPool.Builder builder = TaskWorkerPool.builder()
        .handlerRegistry(handlerRegistry)
        .connectionProvider(connectionProvider)
        .taskStore(taskStore)
        .config(props.getWorker().toRunnerConfig());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "taskqueue.worker", name = "enabled", matchIfMissing = true)
  public TaskWorkerLifecycle taskWorkerLifecycle(TaskWorkerPool taskWorkerPool) {
    return new TaskWorkerLifecycle(taskWorkerPool);
  }
}
