package io.taskqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.taskqueue.micrometer.MicrometerMetricsExporter;
import io.taskqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code taskqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TaskQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the worker pool.
 */
@AutoConfiguration(before = TaskQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "taskqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TaskQueueProperties.class)
public class TaskQueueMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, TaskQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
