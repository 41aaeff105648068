package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.enqueue.EnqueueOptions;
import io.taskqueue.enqueue.TaskQueue;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.wellness.WellnessJson;
import io.taskqueue.wellness.insight.InsightJobPayload.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Producer side of the {@code insights-generate} queue.
 *
 * <p>Admission control runs first: one active job per user, and at most
 * {@code dailyLimit} jobs per user in the trailing 24 hours. The job row and its Task Record
 * are then written in one transaction, so a job is never visible without its task.
 */
public final class InsightGenerationService {
  private static final Logger log = LoggerFactory.getLogger(InsightGenerationService.class);
  private static final Duration RATE_WINDOW = Duration.ofHours(24);

  public static final int DEFAULT_DAILY_LIMIT = 3;

  public static final List<ProviderConfig> DEFAULT_PIPELINE = List.of(
      new ProviderConfig("openchat-5", "openchat/openchat-5", 0.2, 900, InsightPromptBuilder.DEFAULT_SYSTEM_PROMPT),
      new ProviderConfig("gemini-2.5-pro", "google/gemini-2.5-pro", 0.2, 900,
          "You are a wellness coach crafting short insights from trend summaries. Return strictly JSON with " +
          "title, summary, and body { insights: string[], recommendations: string[] }."));

  private final ConnectionProvider connectionProvider;
  private final InsightJobRepository jobRepository;
  private final TaskQueue queue;
  private final List<ProviderConfig> pipeline;
  private final int dailyLimit;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private InsightGenerationService(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobRepository = Objects.requireNonNull(builder.jobRepository, "jobRepository");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.pipeline = List.copyOf(builder.pipeline);
    this.dailyLimit = builder.dailyLimit;
    this.objectMapper = builder.objectMapper;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a QUEUED job and enqueues its task.
   *
   * @return the created job
   * @throws InsightJobInProgressException if the user already has a QUEUED or RUNNING job
   * @throws InsightRateLimitedException   if the user reached the daily limit
   * @throws SQLException                  if the transaction cannot be completed
   */
  public InsightGenerationJob requestGeneration(String userId, InsightRequest request) throws SQLException {
    Objects.requireNonNull(userId, "userId");
    InsightRequest raw = request == null ? InsightRequest.empty() : request;

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        InsightGenerationJob job = admitAndCreate(conn, userId, raw);
        conn.commit();
        log.info("Queued insight job {} for user {} as task {}", job.id(), userId, job.taskName());
        return job;
      } catch (RuntimeException | SQLException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  private InsightGenerationJob admitAndCreate(Connection conn, String userId, InsightRequest request) {
    jobRepository.findActiveByUser(conn, userId).ifPresent(active -> {
      throw new InsightJobInProgressException(active.id());
    });

    Instant now = clock.instant();
    Instant windowStart = now.minus(RATE_WINDOW);
    int recent = jobRepository.countCreatedSince(conn, userId, windowStart);
    if (recent >= dailyLimit) {
      throw new InsightRateLimitedException(dailyLimit, recent, windowStart);
    }

    String taskName = queue.name() + "-" + userId + "-" + now.toEpochMilli();
    InsightGenerationJob job = InsightGenerationJob.queued(UUID.randomUUID().toString(), userId, queue.name(),
        taskName, InsightJobPayload.initial(request.sanitize(), pipeline), now);
    jobRepository.insert(conn, job);
    queue.enqueue(conn, toJson(new InsightTaskPayload(job.id(), userId)),
        EnqueueOptions.none().withTaskName(taskName).withJobId(job.id()));
    return job;
  }

  private String toJson(InsightTaskPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize insight task payload", e);
    }
  }

  /**
   * Builder for {@link InsightGenerationService}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private InsightJobRepository jobRepository;
    private TaskQueue queue;
    private List<ProviderConfig> pipeline = DEFAULT_PIPELINE;
    private int dailyLimit = DEFAULT_DAILY_LIMIT;
    private ObjectMapper objectMapper = WellnessJson.newObjectMapper();
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder jobRepository(InsightJobRepository jobRepository) {
      this.jobRepository = jobRepository;
      return this;
    }

    /**
     * The {@code insights-generate} queue, see {@link io.taskqueue.wellness.WellnessQueues#insightsGenerate}.
     *
     * <p><b>Required.</b>
     */
    public Builder queue(TaskQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Providers snapshotted into every new job, tried in order.
     *
     * <p>Optional. Defaults to {@link #DEFAULT_PIPELINE}.
     */
    public Builder pipeline(List<ProviderConfig> pipeline) {
      Objects.requireNonNull(pipeline, "pipeline");
      if (pipeline.isEmpty()) {
        throw new IllegalArgumentException("pipeline must not be empty");
      }
      this.pipeline = pipeline;
      return this;
    }

    /**
     * <p>Optional. Defaults to 3.
     */
    public Builder dailyLimit(int dailyLimit) {
      if (dailyLimit < 1) {
        throw new IllegalArgumentException("dailyLimit must be >= 1");
      }
      this.dailyLimit = dailyLimit;
      return this;
    }

    /** <p>Optional. Defaults to {@link WellnessJson#newObjectMapper()}. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
      return this;
    }

    /** <p>Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public InsightGenerationService build() {
      return new InsightGenerationService(this);
    }
  }
}
