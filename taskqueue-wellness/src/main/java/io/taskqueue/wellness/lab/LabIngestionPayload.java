package io.taskqueue.wellness.lab;

/**
 * Task Record payload of the {@code lab-upload-ingest} queue.
 */
public record LabIngestionPayload(String uploadId, String userId) {

  boolean isComplete() {
    return uploadId != null && !uploadId.isBlank() && userId != null && !userId.isBlank();
  }
}
