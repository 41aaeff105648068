package io.taskqueue.wellness;

import io.taskqueue.RetryConfig;
import io.taskqueue.enqueue.TaskEnqueuer;
import io.taskqueue.enqueue.TaskQueue;

/**
 * Queues of the wellness platform and their retry descriptors.
 */
public final class WellnessQueues {

  public static final String INSIGHTS_GENERATE = "insights-generate";
  public static final String WEARABLE_SYNC = "wearable-sync";
  public static final String NOTIFICATIONS_DISPATCH = "notifications-dispatch";
  public static final String LAB_UPLOAD_INGEST = "lab-upload-ingest";

  public static final RetryConfig INSIGHTS_RETRY = RetryConfig.of(5, 60, 900);
  public static final RetryConfig WEARABLE_SYNC_RETRY = RetryConfig.of(5, 60, 600);
  public static final RetryConfig NOTIFICATIONS_RETRY = RetryConfig.of(5, 60, 900);
  public static final RetryConfig LAB_UPLOAD_RETRY = RetryConfig.of(3, 120, 1800);

  private WellnessQueues() {}

  public static TaskQueue insightsGenerate(TaskEnqueuer enqueuer) {
    return new TaskQueue(INSIGHTS_GENERATE, INSIGHTS_RETRY, enqueuer);
  }

  public static TaskQueue wearableSync(TaskEnqueuer enqueuer) {
    return new TaskQueue(WEARABLE_SYNC, WEARABLE_SYNC_RETRY, enqueuer);
  }

  public static TaskQueue notificationsDispatch(TaskEnqueuer enqueuer) {
    return new TaskQueue(NOTIFICATIONS_DISPATCH, NOTIFICATIONS_RETRY, enqueuer);
  }

  public static TaskQueue labUploadIngest(TaskEnqueuer enqueuer) {
    return new TaskQueue(LAB_UPLOAD_INGEST, LAB_UPLOAD_RETRY, enqueuer);
  }
}
