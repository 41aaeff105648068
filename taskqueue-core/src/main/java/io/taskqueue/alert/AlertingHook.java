package io.taskqueue.alert;

import java.util.Map;

/**
 * Escalation channel for failures that need a human, such as a task failing on its last
 * allowed attempt.
 *
 * @see LoggingAlertingHook
 */
@FunctionalInterface
public interface AlertingHook {

  /**
   * Raises an alert.
   *
   * @param event   dotted event name, e.g. {@code notifications.dead_letter}
   * @param details context for whoever receives the alert
   */
  void notify(String event, Map<String, Object> details);
}
