/**
 * Dead-letter escalation hook.
 */
package io.taskqueue.alert;
