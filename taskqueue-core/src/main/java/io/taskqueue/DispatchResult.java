package io.taskqueue;

import java.util.Objects;

/**
 * Result returned by {@link TaskHandler#handle(String)} telling the worker runner how to
 * record the dispatch on the Task Record.
 *
 * <ul>
 *   <li>{@link Succeeded}: the runner marks the task SUCCEEDED.</li>
 *   <li>{@link Failed}: the runner marks the task FAILED with the given reason.</li>
 *   <li>{@link Handled}: the handler already persisted the outcome; the runner leaves
 *       the record untouched.</li>
 * </ul>
 *
 * <p>A handler that throws is treated as a runner-level failure: the task is marked
 * FAILED with the exception message and the runner backs off before its next claim.
 *
 * @see TaskHandler
 */
public sealed interface DispatchResult
    permits DispatchResult.Succeeded, DispatchResult.Failed, DispatchResult.Handled {

  /**
   * Singleton indicating successful processing.
   */
  Succeeded SUCCEEDED = new Succeeded();

  /**
   * Singleton indicating the handler recorded the outcome itself.
   */
  Handled HANDLED = new Handled();

  static Succeeded succeeded() {
    return SUCCEEDED;
  }

  static Handled handled() {
    return HANDLED;
  }

  /**
   * Creates a {@link Failed} result carrying the reason stored as the task's error message.
   *
   * @param reason human-readable failure reason
   * @return a failed result
   * @throws NullPointerException if {@code reason} is null
   */
  static Failed failed(String reason) {
    return new Failed(reason);
  }

  /**
   * Task processed successfully.
   */
  record Succeeded() implements DispatchResult {
  }

  /**
   * Task processed and failed for a business reason.
   *
   * @param reason failure reason (never null)
   */
  record Failed(String reason) implements DispatchResult {
    public Failed {
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }

  /**
   * Handler wrote the final status itself.
   */
  record Handled() implements DispatchResult {
  }
}
