/**
 * Email notifications on the {@code notifications-dispatch} queue, with dead-letter
 * alerting once a task's attempts are exhausted.
 */
package io.taskqueue.wellness.notification;
