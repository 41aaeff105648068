package io.taskqueue.wellness.lab;

import java.util.Map;

/**
 * Object storage holding raw uploads and their sealed copies.
 */
public interface ArtifactStorage {

  byte[] download(String key) throws Exception;

  /**
   * Stores {@code content} under {@code key}, replacing any existing object.
   *
   * @param metadata object metadata, e.g. seal parameters
   */
  void save(String key, byte[] content, String contentType, Map<String, String> metadata) throws Exception;
}
