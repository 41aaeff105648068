package io.taskqueue.registry;

import io.taskqueue.TaskHandler;

import java.util.Set;

/**
 * Maps queue names to the {@link TaskHandler} that processes them.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler registered for a queue.
   *
   * @param queue the queue name
   * @return the handler, or {@code null} if none is registered
   */
  TaskHandler handlerFor(String queue);

  /**
   * Returns the names of all queues that have a handler, in registration order.
   */
  Set<String> queues();
}
