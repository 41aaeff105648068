package io.taskqueue.wellness.insight;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds provider prompts from the sanitized request only. The output depends on nothing
 * but its inputs, so every provider in the pipeline sees the same user prompt.
 */
public final class InsightPromptBuilder {

  public static final String DEFAULT_SYSTEM_PROMPT =
      "You are a concise wellness coach. Focus on progressive, actionable guidance grounded in biomarker trends. " +
      "Respond strictly in JSON with keys: title (string), summary (string), body (object with fields " +
      "insights (array of strings) and recommendations (array of strings)).";

  private InsightPromptBuilder() {}

  public static String systemPrompt(InsightJobPayload.ProviderConfig config) {
    String prompt = config.systemPrompt();
    return prompt == null || prompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : prompt;
  }

  public static String userPrompt(InsightJobPayload.Request request) {
    List<String> lines = new ArrayList<>();
    lines.add("Focus area: " + (request.focus() != null ? request.focus() : "general readiness") + ".");
    lines.add("Time window: last " + request.biomarkerWindowDays() + " day(s).");
    lines.add("Manual logs included: " + (request.includeManualLogs() ? "yes" : "no") + ".");
    lines.add("Avoid referencing personal identifiers; rely only on aggregated biomarker trends.");
    lines.add("Respond strictly in JSON with keys title, summary, and body " +
        "{ insights: string[], recommendations: string[] }.");
    if (request.retryOf() != null) {
      lines.add("This request retries insight " + request.retryOf() +
          "; improve clarity and note any adaptive recommendations.");
    }
    lines.add("Provide 2 short insights and 2 actionable recommendations tailored to the focus area.");
    return String.join("\n", lines);
  }
}
