package io.taskqueue.wellness.wearable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a wearable sync was requested; serialized as its kebab-case wire value.
 */
public enum SyncReason {
  INITIAL_LINK("initial-link"),
  SCHEDULED("scheduled"),
  MANUAL_RETRY("manual-retry");

  private final String value;

  SyncReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static SyncReason fromValue(String value) {
    for (SyncReason reason : values()) {
      if (reason.value.equals(value)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("Unknown sync reason: " + value);
  }
}
