/**
 * Enqueue protocol: task naming, per-call options and per-queue producers.
 */
package io.taskqueue.enqueue;
