package io.taskqueue.wellness.wearable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Task Record payload of the {@code wearable-sync} queue.
 *
 * @param externalUserId the member's id at the wearable vendor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WearableSyncPayload(String userId, String externalUserId, SyncReason reason) {

  boolean isComplete() {
    return userId != null && !userId.isBlank()
        && externalUserId != null && !externalUserId.isBlank()
        && reason != null;
  }
}
