/**
 * Wellness platform task handlers and producers built on the task queue.
 *
 * <p>Each subpackage owns one queue: {@code insight} (multi-provider insight generation
 * with failover), {@code wearable} (wearable data sync), {@code notification} (email
 * dispatch with dead-letter alerting) and {@code lab} (lab report ingestion).
 */
package io.taskqueue.wellness;
