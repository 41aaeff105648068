package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON document stored with each {@link InsightGenerationJob}.
 *
 * @param request  the sanitized request; the only user input that reaches a prompt
 * @param models   provider pipeline snapshot taken when the job was created, tried in order
 * @param attempts one entry per provider call across all dispatches
 * @param metrics  retry and failover bookkeeping
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightJobPayload(
    Request request,
    List<ProviderConfig> models,
    List<Attempt> attempts,
    Metrics metrics
) {

  public InsightJobPayload {
    request = request == null ? Request.defaults() : request;
    models = models == null ? List.of() : List.copyOf(models);
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
    metrics = metrics == null ? Metrics.initial() : metrics;
  }

  public static InsightJobPayload initial(Request request, List<ProviderConfig> models) {
    return new InsightJobPayload(request, models, List.of(), Metrics.initial());
  }

  public InsightJobPayload withAttempt(Attempt attempt) {
    List<Attempt> next = new ArrayList<>(attempts);
    next.add(Objects.requireNonNull(attempt, "attempt"));
    return new InsightJobPayload(request, models, next, metrics);
  }

  public InsightJobPayload withMetrics(Metrics metrics) {
    return new InsightJobPayload(request, models, attempts, metrics);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Request(String focus, int biomarkerWindowDays, boolean includeManualLogs, String retryOf) {
    public static final int DEFAULT_WINDOW_DAYS = 7;

    static Request defaults() {
      return new Request(null, DEFAULT_WINDOW_DAYS, true, null);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ProviderConfig(String id, String model, Double temperature, Integer maxTokens, String systemPrompt) {
    public static final double DEFAULT_TEMPERATURE = 0.2;
    public static final int DEFAULT_MAX_TOKENS = 900;

    public ProviderConfig {
      id = id == null ? "model" : id;
      model = model == null ? "unknown" : model;
      temperature = temperature == null ? DEFAULT_TEMPERATURE : temperature;
      maxTokens = maxTokens == null ? DEFAULT_MAX_TOKENS : maxTokens;
    }
  }

  public enum AttemptStatus {
    SUCCESS,
    FAILED
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Attempt(
      String modelId,
      String model,
      AttemptStatus status,
      String responseId,
      String errorMessage,
      Instant completedAt
  ) {
    public static Attempt success(ProviderConfig config, String responseId, Instant completedAt) {
      return new Attempt(config.id(), config.model(), AttemptStatus.SUCCESS, responseId, null, completedAt);
    }

    public static Attempt failure(ProviderConfig config, String errorMessage, Instant completedAt) {
      return new Attempt(config.id(), config.model(), AttemptStatus.FAILED, null, errorMessage, completedAt);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metrics(int retryCount, boolean failoverUsed) {
    static Metrics initial() {
      return new Metrics(0, false);
    }
  }
}
