package io.taskqueue.wellness.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.TaskLookup;
import io.taskqueue.alert.AlertingHook;
import io.taskqueue.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Handler for the {@code notifications-dispatch} queue.
 *
 * <p>Failures are returned as {@link DispatchResult.Failed}. When the failing attempt is
 * the last one the task's retry descriptor allows, a {@value #DEAD_LETTER_EVENT} alert is
 * raised; earlier failures raise nothing.
 */
public final class NotificationHandler implements TaskHandler {
  private static final Logger log = LoggerFactory.getLogger(NotificationHandler.class);

  public static final String DEAD_LETTER_EVENT = "notifications.dead_letter";
  static final String INVALID_PAYLOAD = "Notification payload is invalid";

  private final TaskLookup taskLookup;
  private final NotificationTemplates templates;
  private final EmailSender sender;
  private final AlertingHook alertingHook;
  private final ObjectMapper objectMapper;

  public NotificationHandler(TaskLookup taskLookup, NotificationTemplates templates, EmailSender sender,
      AlertingHook alertingHook, ObjectMapper objectMapper) {
    this.taskLookup = Objects.requireNonNull(taskLookup, "taskLookup");
    this.templates = Objects.requireNonNull(templates, "templates");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.alertingHook = Objects.requireNonNull(alertingHook, "alertingHook");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public DispatchResult handle(String taskName) throws Exception {
    Optional<TaskRecord> found = taskLookup.find(taskName);
    if (found.isEmpty()) {
      log.warn("[notifications] No task record found for {}", taskName);
      return DispatchResult.failed("Task " + taskName + " was not found.");
    }
    TaskRecord task = found.get();
    boolean finalAttempt = task.retryConfig().isExhausted(task.attemptCount() + 1);

    Optional<NotificationPayload> parsed = NotificationPayload.parse(objectMapper, task.payloadJson());
    if (parsed.isEmpty()) {
      log.error("[notifications] Task payload missing required fields: task={}, payload={}",
          taskName, task.payloadJson());
      if (finalAttempt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("taskName", taskName);
        details.put("reason", "invalid-payload");
        raiseDeadLetter(details);
      }
      return DispatchResult.failed(INVALID_PAYLOAD);
    }
    NotificationPayload payload = parsed.get();

    try {
      sender.send(templates.render(payload));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (Exception e) {
      String message = e.getMessage() != null ? e.getMessage() : "Unknown notification failure";
      log.error("[notifications] Failed to deliver notification: type={}, recipient={}, task={}, error={}",
          payload.type(), payload.recipient().id(), taskName, message);
      if (finalAttempt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("taskName", taskName);
        details.put("type", payload.type().name());
        details.put("recipientId", payload.recipient().id());
        details.put("error", message);
        raiseDeadLetter(details);
      }
      return DispatchResult.failed(message);
    }

    log.info("[notifications] Delivered notification: type={}, recipient={}, task={}",
        payload.type(), payload.recipient().id(), taskName);
    return DispatchResult.succeeded();
  }

  private void raiseDeadLetter(Map<String, Object> details) {
    try {
      alertingHook.notify(DEAD_LETTER_EVENT, details);
    } catch (RuntimeException e) {
      log.error("[notifications] Alerting hook failed for {}", details.get("taskName"), e);
    }
  }
}
