package io.taskqueue.wellness.lab;

/**
 * Thrown when a task refers to an upload that does not exist for the given user.
 */
public class LabUploadNotFoundException extends RuntimeException {

  public LabUploadNotFoundException(String uploadId, String userId) {
    super("Upload " + uploadId + " not found for user " + userId);
  }
}
