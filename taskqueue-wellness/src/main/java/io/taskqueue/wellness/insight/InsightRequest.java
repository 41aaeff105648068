package io.taskqueue.wellness.insight;

/**
 * Caller-supplied insight request. Every field is optional.
 */
public record InsightRequest(String focus, Integer biomarkerWindowDays, Boolean includeManualLogs,
    String retryOf) {

  public static InsightRequest empty() {
    return new InsightRequest(null, null, null, null);
  }

  /**
   * Trims free text (blank becomes absent) and applies the defaults: seven days, manual logs
   * included.
   */
  public InsightJobPayload.Request sanitize() {
    return new InsightJobPayload.Request(
        trimToNull(focus),
        biomarkerWindowDays != null ? biomarkerWindowDays : InsightJobPayload.Request.DEFAULT_WINDOW_DAYS,
        includeManualLogs == null || includeManualLogs,
        trimToNull(retryOf));
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
