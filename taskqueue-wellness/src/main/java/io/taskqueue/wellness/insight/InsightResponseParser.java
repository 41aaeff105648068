package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates a completion against the insight schema: non-empty {@code title} and
 * {@code summary}, and {@code body.insights} / {@code body.recommendations} as non-empty
 * arrays of non-blank strings. A surrounding Markdown code fence is tolerated.
 */
public final class InsightResponseParser {

  private final ObjectMapper objectMapper;

  public InsightResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public ParsedInsight parse(String content) throws InsightResponseException {
    if (content == null || content.isBlank()) {
      throw new InsightResponseException("Provider returned an empty response");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(content.trim()));
    } catch (JsonProcessingException e) {
      throw new InsightResponseException("Provider response is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new InsightResponseException("Provider response is not a JSON object");
    }

    String title = requiredText(root, "title");
    String summary = requiredText(root, "summary");
    JsonNode body = root.get("body");
    if (body == null || !body.isObject()) {
      throw new InsightResponseException("Provider response is missing object field 'body'");
    }
    List<String> insights = requiredStrings(body, "insights");
    List<String> recommendations = requiredStrings(body, "recommendations");

    ObjectNode normalizedBody = objectMapper.createObjectNode();
    insights.forEach(normalizedBody.putArray("insights")::add);
    recommendations.forEach(normalizedBody.putArray("recommendations")::add);
    return new ParsedInsight(title, summary, insights, recommendations, normalizedBody.toString());
  }

  static String stripCodeFence(String content) {
    if (!content.startsWith("```")) {
      return content;
    }
    int firstNewline = content.indexOf('\n');
    int closing = content.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return content;
    }
    return content.substring(firstNewline + 1, closing).trim();
  }

  private static String requiredText(JsonNode node, String field) throws InsightResponseException {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new InsightResponseException("Provider response is missing non-empty string field '" + field + "'");
    }
    return value.asText().trim();
  }

  private static List<String> requiredStrings(JsonNode body, String field) throws InsightResponseException {
    JsonNode array = body.get(field);
    if (array == null || !array.isArray() || array.isEmpty()) {
      throw new InsightResponseException("Provider response is missing non-empty array 'body." + field + "'");
    }
    List<String> values = new ArrayList<>();
    for (JsonNode item : array) {
      if (!item.isTextual() || item.asText().isBlank()) {
        throw new InsightResponseException("'body." + field + "' must contain only non-empty strings");
      }
      values.add(item.asText().trim());
    }
    return values;
  }

  /**
   * @param bodyJson normalized {@code body} object, stored on the {@link Insight}
   */
  public record ParsedInsight(String title, String summary, List<String> insights,
      List<String> recommendations, String bodyJson) {
  }
}
