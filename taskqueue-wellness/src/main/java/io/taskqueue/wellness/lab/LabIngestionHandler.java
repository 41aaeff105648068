package io.taskqueue.wellness.lab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.TaskLookup;
import io.taskqueue.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Handler for the {@code lab-upload-ingest} queue.
 *
 * <p>The downloaded bytes are checked against the upload's recorded SHA-256 before anything
 * else happens. A mismatch is recorded with the {@link LabIngestionSink} and the task fails
 * without parsing. Otherwise a sealed copy is stored at
 * {@code sealed/<userId>/<uploadId>-<epochMillis>.sealed}, the report is parsed and applied,
 * and plan linking runs last. Linking failures are logged only.
 */
public final class LabIngestionHandler implements TaskHandler {
  private static final Logger log = LoggerFactory.getLogger(LabIngestionHandler.class);

  static final String MISSING_IDENTIFIERS = "Task payload missing uploadId or userId.";
  static final String INTEGRITY_FAILED = "Integrity verification failed";

  private final TaskLookup taskLookup;
  private final LabUploadStore uploadStore;
  private final ArtifactStorage storage;
  private final ArtifactSealer sealer;
  private final LabReportParser parser;
  private final LabIngestionSink sink;
  private final LabPlanLinker planLinker;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private LabIngestionHandler(Builder builder) {
    this.taskLookup = Objects.requireNonNull(builder.taskLookup, "taskLookup");
    this.uploadStore = Objects.requireNonNull(builder.uploadStore, "uploadStore");
    this.storage = Objects.requireNonNull(builder.storage, "storage");
    this.sealer = Objects.requireNonNull(builder.sealer, "sealer");
    this.parser = Objects.requireNonNull(builder.parser, "parser");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.planLinker = builder.planLinker != null ? builder.planLinker : LabPlanLinker.NOOP;
    this.objectMapper = Objects.requireNonNull(builder.objectMapper, "objectMapper");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public DispatchResult handle(String taskName) throws Exception {
    Optional<TaskRecord> task = taskLookup.find(taskName);
    if (task.isEmpty()) {
      log.warn("[lab-ingest] No task record found for {}", taskName);
      return DispatchResult.failed("Task " + taskName + " was not found.");
    }
    LabIngestionPayload payload = parse(task.get());
    if (payload == null || !payload.isComplete()) {
      log.error("[lab-ingest] Task payload missing identifiers: task={}, payload={}",
          taskName, task.get().payloadJson());
      return DispatchResult.failed(MISSING_IDENTIFIERS);
    }

    LabUpload upload = uploadStore.find(payload.uploadId(), payload.userId())
        .orElseThrow(() -> new LabUploadNotFoundException(payload.uploadId(), payload.userId()));

    byte[] content = storage.download(upload.storageKey());
    String computed = sha256Hex(content);
    if (upload.sha256Hash() != null && !upload.sha256Hash().equalsIgnoreCase(computed)) {
      log.warn("[lab-ingest] Hash mismatch for upload {}: expected={}, received={}",
          upload.id(), upload.sha256Hash(), computed);
      sink.apply(upload.userId(), upload.id(),
          new LabIngestionOutcome.IntegrityFailure(upload.sha256Hash(), computed));
      return DispatchResult.failed(INTEGRITY_FAILED);
    }

    SealedArtifact sealed = sealer.seal(content);
    String sealedKey = "sealed/" + upload.userId() + "/" + upload.id() + "-" + clock.millis() + ".sealed";
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("x-seal-iv", sealed.iv());
    metadata.put("x-seal-tag", sealed.authTag());
    metadata.put("x-seal-alg", sealed.algorithm());
    storage.save(sealedKey, sealed.ciphertext(), "application/octet-stream", metadata);

    LabReportParser.Result result = parser.parse(
        new String(content, charsetFor(upload.contentType())), upload.contentType());
    sink.apply(upload.userId(), upload.id(), new LabIngestionOutcome.Ingested(
        result.summary(), result.notes(), result.measurements(), sealedKey,
        LabIngestionOutcome.SEALED_KEY_VERSION));

    try {
      planLinker.autoLink(upload.id(), upload.userId(), result.measurements());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (Exception e) {
      log.warn("[lab-ingest] Plan auto-linking failed for upload {} (user {})", upload.id(), upload.userId(), e);
    }

    log.info("[lab-ingest] Ingested upload {}: {} measurements, sealed at {}",
        upload.id(), result.measurements().size(), sealedKey);
    return DispatchResult.succeeded();
  }

  private LabIngestionPayload parse(TaskRecord task) {
    try {
      return objectMapper.readValue(task.payloadJson(), LabIngestionPayload.class);
    } catch (JsonProcessingException e) {
      log.debug("[lab-ingest] Unreadable payload for task {}", task.name(), e);
      return null;
    }
  }

  static Charset charsetFor(String contentType) {
    if (contentType == null
        || contentType.contains("json")
        || contentType.contains("csv")
        || contentType.startsWith("text/")) {
      return StandardCharsets.UTF_8;
    }
    return StandardCharsets.ISO_8859_1;
  }

  static String sha256Hex(byte[] content) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Builder for {@link LabIngestionHandler}.
   */
  public static final class Builder {
    private TaskLookup taskLookup;
    private LabUploadStore uploadStore;
    private ArtifactStorage storage;
    private ArtifactSealer sealer;
    private LabReportParser parser;
    private LabIngestionSink sink;
    private LabPlanLinker planLinker;
    private ObjectMapper objectMapper;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder taskLookup(TaskLookup taskLookup) {
      this.taskLookup = taskLookup;
      return this;
    }

    /** <b>Required.</b> */
    public Builder uploadStore(LabUploadStore uploadStore) {
      this.uploadStore = uploadStore;
      return this;
    }

    /** <b>Required.</b> Holds raw uploads and receives the sealed copy. */
    public Builder storage(ArtifactStorage storage) {
      this.storage = storage;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sealer(ArtifactSealer sealer) {
      this.sealer = sealer;
      return this;
    }

    /** <b>Required.</b> */
    public Builder parser(LabReportParser parser) {
      this.parser = parser;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sink(LabIngestionSink sink) {
      this.sink = sink;
      return this;
    }

    /** Optional. Defaults to {@link LabPlanLinker#NOOP}. */
    public Builder planLinker(LabPlanLinker planLinker) {
      this.planLinker = planLinker;
      return this;
    }

    /** <b>Required.</b> */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public LabIngestionHandler build() {
      return new LabIngestionHandler(this);
    }
  }
}
