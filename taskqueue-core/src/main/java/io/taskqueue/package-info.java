/**
 * Durable task queue: handler contract, dispatch results and retry descriptors.
 *
 * <p>Producers insert Task Records through {@link io.taskqueue.enqueue.TaskEnqueuer};
 * one {@link io.taskqueue.runner.WorkerRunner} per queue claims them from the store and
 * invokes the {@link io.taskqueue.TaskHandler} registered for that queue.
 */
package io.taskqueue;
