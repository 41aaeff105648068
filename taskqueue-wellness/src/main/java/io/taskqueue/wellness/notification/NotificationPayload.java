package io.taskqueue.wellness.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Task Record payload of the {@code notifications-dispatch} queue.
 *
 * @param channel only {@code email} is supported
 * @param data    type-specific template fields, e.g. {@code insightTitle} for INSIGHT_ALERT
 */
public record NotificationPayload(
    NotificationType type,
    String channel,
    Recipient recipient,
    Map<String, Object> data
) {

  public static final String EMAIL_CHANNEL = "email";

  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  public NotificationPayload {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(recipient, "recipient");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  /**
   * @param displayName may be empty; templates fall back to a neutral greeting
   */
  public record Recipient(String id, String email, String displayName) {
    public Recipient {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(email, "email");
      displayName = displayName == null ? "" : displayName;
    }
  }

  /**
   * Parses and validates a payload. Returns empty when the type is unknown, the channel is
   * not email, the recipient lacks an id or email, or {@code data} is not an object.
   */
  public static Optional<NotificationPayload> parse(ObjectMapper objectMapper, String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }

    NotificationType type = parseType(root.get("type"));
    JsonNode channelNode = root.get("channel");
    String channel = channelNode != null && channelNode.isTextual() ? channelNode.asText() : EMAIL_CHANNEL;
    JsonNode recipientNode = root.get("recipient");
    JsonNode dataNode = root.get("data");
    if (type == null || !EMAIL_CHANNEL.equals(channel)
        || recipientNode == null || !recipientNode.isObject()
        || dataNode == null || !dataNode.isObject()) {
      return Optional.empty();
    }

    String id = text(recipientNode, "id");
    String email = text(recipientNode, "email");
    if (id == null || email == null) {
      return Optional.empty();
    }
    String displayName = text(recipientNode, "displayName");
    Map<String, Object> data = objectMapper.convertValue(dataNode, DATA_TYPE);
    data.values().removeIf(Objects::isNull);
    return Optional.of(new NotificationPayload(type, channel, new Recipient(id, email, displayName), data));
  }

  private static NotificationType parseType(JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    try {
      return NotificationType.valueOf(node.asText());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  /**
   * Reads a data field as text, or {@code null} when absent.
   */
  public String dataText(String key) {
    Object value = data.get(key);
    return value == null ? null : value.toString();
  }
}
