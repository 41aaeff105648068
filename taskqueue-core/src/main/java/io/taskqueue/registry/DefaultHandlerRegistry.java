package io.taskqueue.registry;

import io.taskqueue.TaskHandler;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry with exactly one handler per queue.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("insights-generate", insightHandler)
 *     .register("notifications-dispatch", notificationHandler);
 * }</pre>
 *
 * <p>Registering a second handler for a queue fails instead of silently replacing the
 * first one.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();
  private final Set<String> order = Collections.synchronizedSet(new LinkedHashSet<>());

  /**
   * Registers the handler for a queue.
   *
   * @param queue   the queue name
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if the queue already has a handler
   */
  public DefaultHandlerRegistry register(String queue, TaskHandler handler) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(handler, "handler");
    if (queue.isBlank()) {
      throw new IllegalArgumentException("queue must not be blank");
    }
    TaskHandler existing = handlers.putIfAbsent(queue, handler);
    if (existing != null) {
      throw new IllegalStateException("Handler already registered for queue: " + queue);
    }
    order.add(queue);
    return this;
  }

  @Override
  public TaskHandler handlerFor(String queue) {
    return handlers.get(queue);
  }

  @Override
  public Set<String> queues() {
    synchronized (order) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(order));
    }
  }
}
