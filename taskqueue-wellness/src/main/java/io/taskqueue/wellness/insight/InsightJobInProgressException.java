package io.taskqueue.wellness.insight;

public final class InsightJobInProgressException extends InsightAdmissionException {
  public static final String CODE = "INSIGHT_JOB_IN_PROGRESS";

  private final String jobId;

  public InsightJobInProgressException(String jobId) {
    super("An insight generation job is already in progress.");
    this.jobId = jobId;
  }

  @Override
  public String code() {
    return CODE;
  }

  public String jobId() {
    return jobId;
  }
}
