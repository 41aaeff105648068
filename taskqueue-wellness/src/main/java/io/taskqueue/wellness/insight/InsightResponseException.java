package io.taskqueue.wellness.insight;

/**
 * A provider answered, but not with a usable insight document.
 */
public class InsightResponseException extends Exception {

  public InsightResponseException(String message) {
    super(message);
  }

  public InsightResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
