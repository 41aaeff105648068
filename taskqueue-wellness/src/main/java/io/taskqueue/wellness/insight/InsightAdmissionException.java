package io.taskqueue.wellness.insight;

/**
 * An insight request was refused before any job was created.
 */
public abstract class InsightAdmissionException extends RuntimeException {

  protected InsightAdmissionException(String message) {
    super(message);
  }

  /**
   * Stable machine-readable reason, e.g. {@code INSIGHT_RATE_LIMITED}.
   */
  public abstract String code();
}
