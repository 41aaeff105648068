package io.taskqueue.alert;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AlertingHook} that writes every alert as a SEVERE log record.
 */
public final class LoggingAlertingHook implements AlertingHook {
  private static final Logger logger = Logger.getLogger(LoggingAlertingHook.class.getName());

  @Override
  public void notify(String event, Map<String, Object> details) {
    logger.log(Level.SEVERE, "Alert triggered: " + event + " " + details);
  }
}
