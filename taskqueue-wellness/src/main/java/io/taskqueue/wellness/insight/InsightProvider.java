package io.taskqueue.wellness.insight;

/**
 * A language-model completion endpoint. One client serves every entry of the provider
 * pipeline; the entry's model id selects the backing model.
 */
public interface InsightProvider {

  /**
   * @throws Exception any transport, quota or provider-side failure; the caller moves on
   *                   to the next pipeline entry
   */
  Completion complete(CompletionRequest request) throws Exception;

  record CompletionRequest(String model, String systemPrompt, String userPrompt, double temperature,
      int maxTokens) {
  }

  /**
   * @param responseId provider-side id of the completion, recorded on the job attempt
   * @param content    raw completion text, expected to hold the insight JSON
   */
  record Completion(String responseId, String content) {
  }
}
