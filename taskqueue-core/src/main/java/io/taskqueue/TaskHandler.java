package io.taskqueue;

/**
 * Business logic bound to one queue.
 *
 * <p>The worker runner invokes {@link #handle(String)} with the name of a task it has
 * just claimed. Implementations load whatever they need from the Task Record (or their
 * own domain tables) and report the outcome through the returned {@link DispatchResult}.
 *
 * <p>Handlers must tolerate being invoked twice for the same task name: a task can be
 * re-dispatched after a crash or re-queued after a failure, so any external side effect
 * has to be guarded by the handler's own persisted state.
 *
 * @see io.taskqueue.registry.HandlerRegistry
 */
@FunctionalInterface
public interface TaskHandler {

  /**
   * Processes the named task.
   *
   * @param taskName unique name of the claimed task
   * @return how the runner should record the dispatch (never null)
   * @throws Exception any failure; the runner records it and keeps polling
   */
  DispatchResult handle(String taskName) throws Exception;
}
