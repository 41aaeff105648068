package io.taskqueue.spring.boot;

import io.taskqueue.TaskHandler;
import io.taskqueue.registry.DefaultHandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link TaskQueueHandler} and registers them
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so registration completes before {@link TaskWorkerLifecycle} starts the runners.
 */
public class TaskHandlerRegistrar implements SmartInitializingSingleton {

  private final ListableBeanFactory beanFactory;
  private final DefaultHandlerRegistry registry;

  public TaskHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
    this.beanFactory = beanFactory;
    this.registry = registry;
  }

  @Override
  public void afterSingletonsInstantiated() {
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TaskQueueHandler.class);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();

      if (!(bean instanceof TaskHandler handler)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @TaskQueueHandler must implement TaskHandler, " +
                "but " + bean.getClass().getName() + " does not");
      }

      // Proxies may hide the annotation; search the class hierarchy
      TaskQueueHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), TaskQueueHandler.class);
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find @TaskQueueHandler annotation on " + bean.getClass().getName());
      }
      String queue = annotation.value();
      if (queue.isBlank()) {
        throw new BeanCreationException(beanName, "@TaskQueueHandler must name a queue");
      }

      try {
        registry.register(queue, handler);
      } catch (IllegalStateException e) {
        throw new BeanCreationException(beanName, e.getMessage(), e);
      }
    }
  }
}
