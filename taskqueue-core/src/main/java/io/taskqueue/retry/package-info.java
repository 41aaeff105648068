/**
 * Backoff computation and producer-side re-queueing of failed tasks.
 */
package io.taskqueue.retry;
