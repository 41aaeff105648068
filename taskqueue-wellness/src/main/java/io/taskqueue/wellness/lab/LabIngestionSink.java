package io.taskqueue.wellness.lab;

/**
 * Receives ingestion results for an upload, typically persisting them on the panel.
 */
@FunctionalInterface
public interface LabIngestionSink {

  void apply(String userId, String uploadId, LabIngestionOutcome outcome) throws Exception;
}
