package io.taskqueue.wellness.lab;

import java.util.Optional;

/**
 * Lookup of uploads owned by a user.
 */
@FunctionalInterface
public interface LabUploadStore {

  Optional<LabUpload> find(String uploadId, String userId) throws Exception;
}
