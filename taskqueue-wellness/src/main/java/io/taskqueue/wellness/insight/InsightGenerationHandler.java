package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.TaskLookup;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.wellness.WellnessJson;
import io.taskqueue.wellness.insight.InsightJobPayload.Attempt;
import io.taskqueue.wellness.insight.InsightJobPayload.Metrics;
import io.taskqueue.wellness.insight.InsightJobPayload.ProviderConfig;
import io.taskqueue.wellness.insight.InsightProvider.Completion;
import io.taskqueue.wellness.insight.InsightProvider.CompletionRequest;
import io.taskqueue.wellness.insight.InsightResponseParser.ParsedInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Handler for the {@code insights-generate} queue: walks the job's provider pipeline in
 * order and stops at the first provider whose response validates.
 *
 * <p>Every provider call is recorded as an attempt on the job payload, and the payload is
 * persisted after each failed call so a crash mid-pipeline keeps the history. A job that
 * already SUCCEEDED, or that already has an insight, completes without calling any
 * provider, so re-dispatching the same task never creates a second insight. Any failure
 * that escapes the pipeline after the job went RUNNING marks the job FAILED before it
 * propagates, so the user is never left with a stuck active job.
 */
public final class InsightGenerationHandler implements TaskHandler {
  private static final Logger log = LoggerFactory.getLogger(InsightGenerationHandler.class);

  private final ConnectionProvider connectionProvider;
  private final TaskLookup taskLookup;
  private final InsightJobRepository jobRepository;
  private final InsightRepository insightRepository;
  private final InsightProvider provider;
  private final DashboardCacheInvalidator cacheInvalidator;
  private final ObjectMapper objectMapper;
  private final InsightResponseParser responseParser;
  private final Clock clock;

  private InsightGenerationHandler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskLookup = Objects.requireNonNull(builder.taskLookup, "taskLookup");
    this.jobRepository = Objects.requireNonNull(builder.jobRepository, "jobRepository");
    this.insightRepository = Objects.requireNonNull(builder.insightRepository, "insightRepository");
    this.provider = Objects.requireNonNull(builder.provider, "provider");
    this.cacheInvalidator = builder.cacheInvalidator;
    this.objectMapper = builder.objectMapper;
    this.responseParser = new InsightResponseParser(builder.objectMapper);
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public DispatchResult handle(String taskName) throws Exception {
    Optional<TaskRecord> found = taskLookup.find(taskName);
    if (found.isEmpty()) {
      log.warn("[insights-generate] No task record found for {}", taskName);
      return DispatchResult.failed("Task " + taskName + " was not found.");
    }
    TaskRecord task = found.get();

    InsightTaskPayload payload = parsePayload(task);
    if (payload == null || payload.jobId() == null || payload.userId() == null) {
      log.error("[insights-generate] Missing jobId or userId in task payload: task={}, payload={}",
          taskName, task.payloadJson());
      return DispatchResult.failed("Task payload is missing required identifiers.");
    }

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<InsightGenerationJob> loaded = jobRepository.findById(conn, payload.jobId());
      if (loaded.isEmpty()) {
        log.error("[insights-generate] Referenced job not found: job={}, task={}", payload.jobId(), taskName);
        return DispatchResult.failed("Job " + payload.jobId() + " was not found.");
      }
      InsightGenerationJob job = loaded.get();

      if (job.status() == InsightJobStatus.SUCCEEDED) {
        log.info("[insights-generate] Job {} already succeeded; skipping re-dispatch of {}", job.id(), taskName);
        return DispatchResult.succeeded();
      }
      Optional<Insight> existing = insightRepository.findByJobId(conn, job.id());
      if (existing.isPresent()) {
        log.info("[insights-generate] Job {} already has insight {}; completing job", job.id(), existing.get().id());
        jobRepository.update(conn, job.succeeded(existing.get().id(), job.payload(), clock.instant()));
        return DispatchResult.succeeded();
      }

      job = job.running(clock.instant());
      try {
        jobRepository.update(conn, job);
        return runPipeline(conn, task, payload.userId(), job);
      } catch (Exception e) {
        recordAbort(job.id(), e);
        throw e;
      }
    }
  }

  /**
   * Moves a job left QUEUED or RUNNING by an unexpected failure to FAILED, on a fresh connection so
   * a broken pipeline connection does not block it. The original failure is rethrown by
   * the caller either way.
   */
  private void recordAbort(String jobId, Exception cause) {
    String message = "Insight generation aborted: "
        + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<InsightGenerationJob> latest = jobRepository.findById(conn, jobId);
      if (latest.isEmpty() || !latest.get().status().isActive()) {
        return;
      }
      InsightGenerationJob job = latest.get();
      jobRepository.update(conn, job.failed(InsightGenerationJob.PROVIDER_FAILURE, message, job.payload(),
          clock.instant()));
      log.error("[insights-generate] Job {} marked FAILED after unexpected error", jobId, cause);
    } catch (SQLException | RuntimeException e) {
      log.error("[insights-generate] Could not mark job {} FAILED after unexpected error", jobId, e);
      cause.addSuppressed(e);
    }
  }

  private DispatchResult runPipeline(Connection conn, TaskRecord task, String userId, InsightGenerationJob job)
      throws Exception {
    InsightJobPayload jobPayload = job.payload();
    String userPrompt = InsightPromptBuilder.userPrompt(jobPayload.request());
    int attemptsThisDispatch = 0;
    String lastError = "no providers configured";
    String lastProvider = "pipeline";

    for (ProviderConfig config : jobPayload.models()) {
      attemptsThisDispatch++;
      Completion completion;
      ParsedInsight parsed;
      try {
        completion = provider.complete(new CompletionRequest(config.model(),
            InsightPromptBuilder.systemPrompt(config), userPrompt, config.temperature(), config.maxTokens()));
        parsed = responseParser.parse(completion == null ? null : completion.content());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception e) {
        lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        lastProvider = config.id();
        log.warn("[insights-generate] Provider {} failed for job {}: {}", config.id(), job.id(), lastError);
        jobPayload = jobPayload.withAttempt(Attempt.failure(config, lastError, clock.instant()));
        job = job.withPayload(jobPayload);
        jobRepository.update(conn, job);
        continue;
      }

      Instant now = clock.instant();
      Insight insight = new Insight(UUID.randomUUID().toString(), userId, job.id(), parsed.title(),
          parsed.summary(), parsed.bodyJson(), config.model(), now);
      jobPayload = jobPayload
          .withAttempt(Attempt.success(config, completion.responseId(), now))
          .withMetrics(metrics(task, attemptsThisDispatch));
      completeJob(conn, insight, job.succeeded(insight.id(), jobPayload, now));
      invalidateDashboard(userId);
      log.info("[insights-generate] Insight {} generated for job {} by {} after {} attempt(s)",
          insight.id(), job.id(), config.id(), attemptsThisDispatch);
      return DispatchResult.succeeded();
    }

    String message = "All insight providers failed; last error from " + lastProvider + ": " + lastError;
    jobPayload = jobPayload.withMetrics(metrics(task, attemptsThisDispatch));
    jobRepository.update(conn, job.failed(InsightGenerationJob.PROVIDER_FAILURE, message, jobPayload,
        clock.instant()));
    log.error("[insights-generate] {} (job {})", message, job.id());
    return DispatchResult.failed(message);
  }

  /**
   * Inserts the insight and marks the job SUCCEEDED in one transaction.
   */
  private void completeJob(Connection conn, Insight insight, InsightGenerationJob succeeded) throws SQLException {
    conn.setAutoCommit(false);
    try {
      insightRepository.insert(conn, insight);
      jobRepository.update(conn, succeeded);
      conn.commit();
    } catch (SQLException | RuntimeException e) {
      conn.rollback();
      throw e;
    } finally {
      conn.setAutoCommit(true);
    }
  }

  private static Metrics metrics(TaskRecord task, int attemptsThisDispatch) {
    return new Metrics(task.attemptCount(), task.attemptCount() > 0 || attemptsThisDispatch > 1);
  }

  private void invalidateDashboard(String userId) {
    try {
      cacheInvalidator.invalidateUser(userId);
    } catch (Exception e) {
      log.warn("[insights-generate] Failed to invalidate dashboard cache for user {}", userId, e);
    }
  }

  private InsightTaskPayload parsePayload(TaskRecord task) {
    InsightTaskPayload parsed;
    try {
      parsed = objectMapper.readValue(task.payloadJson(), InsightTaskPayload.class);
    } catch (JsonProcessingException e) {
      log.warn("[insights-generate] Unreadable payload for task {}: {}", task.name(), e.getOriginalMessage());
      return null;
    }
    if (parsed == null) {
      return null;
    }
    if (parsed.jobId() == null && task.jobId() != null) {
      return new InsightTaskPayload(task.jobId(), parsed.userId());
    }
    return parsed;
  }

  /**
   * Builder for {@link InsightGenerationHandler}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TaskLookup taskLookup;
    private InsightJobRepository jobRepository;
    private InsightRepository insightRepository;
    private InsightProvider provider;
    private DashboardCacheInvalidator cacheInvalidator = DashboardCacheInvalidator.NOOP;
    private ObjectMapper objectMapper = WellnessJson.newObjectMapper();
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Connection source for the job and insight tables.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Loads the Task Record being dispatched.
     *
     * <p><b>Required.</b>
     */
    public Builder taskLookup(TaskLookup taskLookup) {
      this.taskLookup = taskLookup;
      return this;
    }

    /** <b>Required.</b> */
    public Builder jobRepository(InsightJobRepository jobRepository) {
      this.jobRepository = jobRepository;
      return this;
    }

    /** <b>Required.</b> */
    public Builder insightRepository(InsightRepository insightRepository) {
      this.insightRepository = insightRepository;
      return this;
    }

    /**
     * Completion client used for every pipeline entry.
     *
     * <p><b>Required.</b>
     */
    public Builder provider(InsightProvider provider) {
      this.provider = provider;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DashboardCacheInvalidator#NOOP}.
     */
    public Builder cacheInvalidator(DashboardCacheInvalidator cacheInvalidator) {
      this.cacheInvalidator = Objects.requireNonNull(cacheInvalidator, "cacheInvalidator");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link WellnessJson#newObjectMapper()}.
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
      return this;
    }

    /**
     * <p>Optional. Defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public InsightGenerationHandler build() {
      return new InsightGenerationHandler(this);
    }
  }
}
