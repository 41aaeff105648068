/**
 * Micrometer integration: per-queue worker counters and handler timings.
 */
package io.taskqueue.micrometer;
