package io.taskqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one queue.
 *
 * <p>The annotated bean must implement {@link io.taskqueue.TaskHandler}.
 *
 * <pre>{@code
 * @Component
 * @TaskQueueHandler("wearable-sync")
 * public class WearableSyncTaskHandler implements TaskHandler {
 *   public DispatchResult handle(String taskName) { ... }
 * }
 * }</pre>
 *
 * @see TaskHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TaskQueueHandler {

  /**
   * Queue name served by the annotated handler.
   */
  String value();
}
