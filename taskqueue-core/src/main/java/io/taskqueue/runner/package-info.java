/**
 * Worker runners: one polling loop per queue, grouped in a pool with a shared shutdown.
 *
 * @see io.taskqueue.runner.WorkerRunner
 * @see io.taskqueue.runner.TaskWorkerPool
 */
package io.taskqueue.runner;
