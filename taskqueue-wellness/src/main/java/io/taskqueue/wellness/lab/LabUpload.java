package io.taskqueue.wellness.lab;

import java.util.Objects;

/**
 * A user's uploaded lab report awaiting ingestion.
 *
 * @param sha256Hash  hex digest recorded at upload time, or {@code null} if none was supplied
 * @param contentType MIME type declared by the client, may be {@code null}
 */
public record LabUpload(String id, String userId, String storageKey, String sha256Hash, String contentType) {

  public LabUpload {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(storageKey, "storageKey");
  }
}
