package io.taskqueue.wellness.wearable;

/**
 * Pulls the member's latest data from the wearable vendor and stores it.
 */
public interface WearableSyncClient {

  void sync(WearableSyncPayload request) throws Exception;
}
