/**
 * Wearable data sync on the {@code wearable-sync} queue.
 */
package io.taskqueue.wellness.wearable;
