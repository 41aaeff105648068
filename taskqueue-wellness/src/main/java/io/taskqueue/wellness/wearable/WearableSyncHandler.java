package io.taskqueue.wellness.wearable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.TaskLookup;
import io.taskqueue.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Handler for the {@code wearable-sync} queue.
 *
 * <p>A malformed payload can never succeed on retry, so it is logged and the task is
 * completed. Client failures propagate and the runner records the task FAILED.
 */
public final class WearableSyncHandler implements TaskHandler {
  private static final Logger log = LoggerFactory.getLogger(WearableSyncHandler.class);

  private final TaskLookup taskLookup;
  private final WearableSyncClient client;
  private final ObjectMapper objectMapper;

  public WearableSyncHandler(TaskLookup taskLookup, WearableSyncClient client, ObjectMapper objectMapper) {
    this.taskLookup = Objects.requireNonNull(taskLookup, "taskLookup");
    this.client = Objects.requireNonNull(client, "client");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public DispatchResult handle(String taskName) throws Exception {
    Optional<TaskRecord> task = taskLookup.find(taskName);
    if (task.isEmpty()) {
      log.warn("[wearable-sync] No task record found for {}", taskName);
      return DispatchResult.failed("Task " + taskName + " was not found.");
    }

    WearableSyncPayload payload = parse(task.get());
    if (payload == null || !payload.isComplete()) {
      log.warn("[wearable-sync] Dropping task {} with malformed payload: {}", taskName, task.get().payloadJson());
      return DispatchResult.succeeded();
    }

    client.sync(payload);
    log.info("[wearable-sync] Synced user {} ({})", payload.userId(), payload.reason().value());
    return DispatchResult.succeeded();
  }

  private WearableSyncPayload parse(TaskRecord task) {
    try {
      return objectMapper.readValue(task.payloadJson(), WearableSyncPayload.class);
    } catch (JsonProcessingException e) {
      log.debug("[wearable-sync] Unreadable payload for task {}", task.name(), e);
      return null;
    }
  }
}
