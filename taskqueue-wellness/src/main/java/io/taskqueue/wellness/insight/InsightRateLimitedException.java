package io.taskqueue.wellness.insight;

import java.time.Instant;

public final class InsightRateLimitedException extends InsightAdmissionException {
  public static final String CODE = "INSIGHT_RATE_LIMITED";

  private final int limit;
  private final int count;
  private final Instant windowStart;

  public InsightRateLimitedException(int limit, int count, Instant windowStart) {
    super("Daily insight generation limit reached.");
    this.limit = limit;
    this.count = count;
    this.windowStart = windowStart;
  }

  @Override
  public String code() {
    return CODE;
  }

  public int limit() {
    return limit;
  }

  public int count() {
    return count;
  }

  public Instant windowStart() {
    return windowStart;
  }
}
