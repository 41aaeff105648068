package io.taskqueue.wellness.lab;

import io.taskqueue.DispatchResult;
import io.taskqueue.wellness.TestTasks;
import io.taskqueue.wellness.WellnessJson;
import io.taskqueue.wellness.WellnessQueues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LabIngestionHandlerTest {
  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
  private static final byte[] REPORT = "marker,value,unit\nLDL,92,mg/dL".getBytes(StandardCharsets.UTF_8);
  private static final String PAYLOAD = "{\"uploadId\":\"up-1\",\"userId\":\"u1\"}";

  private final TestTasks tasks = new TestTasks();
  private final Map<String, LabUpload> uploads = new HashMap<>();
  private final MemoryStorage storage = new MemoryStorage();
  private final List<LabIngestionOutcome> applied = new ArrayList<>();
  private final List<String> parsedTexts = new ArrayList<>();
  private final List<List<LabMeasurement>> linked = new ArrayList<>();
  private final AesGcmArtifactSealer sealer =
      new AesGcmArtifactSealer("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII));
  private LabPlanLinker planLinker = (uploadId, userId, measurements) -> linked.add(measurements);

  @BeforeEach
  void setUp() {
    storage.objects.put("raw/u1/up-1.csv", REPORT);
    tasks.add("lab-1", WellnessQueues.LAB_UPLOAD_INGEST, PAYLOAD, WellnessQueues.LAB_UPLOAD_RETRY, 0);
  }

  private LabIngestionHandler handler() {
    return LabIngestionHandler.builder()
        .taskLookup(tasks)
        .uploadStore((uploadId, userId) -> Optional.ofNullable(uploads.get(uploadId))
            .filter(upload -> upload.userId().equals(userId)))
        .storage(storage)
        .sealer(sealer)
        .parser((text, contentType) -> {
          parsedTexts.add(text);
          return new LabReportParser.Result("1 marker", List.of("LDL within range"),
              List.of(new LabMeasurement("LDL", "bm-ldl", 92.0, "mg/dL", 0.9, null)));
        })
        .sink((userId, uploadId, outcome) -> applied.add(outcome))
        .planLinker(planLinker)
        .objectMapper(WellnessJson.newObjectMapper())
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private void upload(String sha256) {
    uploads.put("up-1", new LabUpload("up-1", "u1", "raw/u1/up-1.csv", sha256, "text/csv"));
  }

  @Test
  void ingestsSealsAndLinksVerifiedUpload() throws Exception {
    upload(LabIngestionHandler.sha256Hex(REPORT));

    assertEquals(DispatchResult.succeeded(), handler().handle("lab-1"));

    String sealedKey = "sealed/u1/up-1-" + NOW.toEpochMilli() + ".sealed";
    assertTrue(storage.objects.containsKey(sealedKey));
    Map<String, String> metadata = storage.metadata.get(sealedKey);
    assertEquals("aes-256-gcm", metadata.get("x-seal-alg"));
    assertArrayEquals(REPORT, sealer.unseal(new SealedArtifact(storage.objects.get(sealedKey),
        metadata.get("x-seal-iv"), metadata.get("x-seal-tag"), metadata.get("x-seal-alg"))));

    assertEquals(List.of(new String(REPORT, StandardCharsets.UTF_8)), parsedTexts);
    LabIngestionOutcome.Ingested ingested = assertInstanceOf(LabIngestionOutcome.Ingested.class, applied.get(0));
    assertEquals(sealedKey, ingested.sealedStorageKey());
    assertEquals("lab-seal-v1", ingested.sealedKeyVersion());
    assertEquals(1, ingested.measurements().size());
    assertEquals(1, linked.size());
  }

  @Test
  void hashMismatchRecordsIntegrityFailureBeforeParsing() throws Exception {
    upload("00".repeat(32));

    assertEquals(DispatchResult.failed("Integrity verification failed"), handler().handle("lab-1"));

    LabIngestionOutcome.IntegrityFailure failure =
        assertInstanceOf(LabIngestionOutcome.IntegrityFailure.class, applied.get(0));
    assertEquals("INGESTION_INTEGRITY_MISMATCH", failure.code());
    assertEquals("Uploaded file hash does not match expected value.", failure.message());
    assertEquals("00".repeat(32), failure.expectedSha256());
    assertEquals(LabIngestionHandler.sha256Hex(REPORT), failure.receivedSha256());
    assertTrue(parsedTexts.isEmpty());
    assertEquals(1, storage.objects.size());
  }

  @Test
  void uploadWithoutRecordedHashSkipsVerification() throws Exception {
    upload(null);

    assertEquals(DispatchResult.succeeded(), handler().handle("lab-1"));
    assertInstanceOf(LabIngestionOutcome.Ingested.class, applied.get(0));
  }

  @Test
  void planLinkFailureDoesNotFailIngestion() throws Exception {
    upload(LabIngestionHandler.sha256Hex(REPORT));
    planLinker = (uploadId, userId, measurements) -> {
      throw new IllegalStateException("plan service down");
    };

    assertEquals(DispatchResult.succeeded(), handler().handle("lab-1"));
    assertEquals(1, applied.size());
  }

  @Test
  void missingIdentifiersFail() throws Exception {
    tasks.add("lab-2", WellnessQueues.LAB_UPLOAD_INGEST, "{\"uploadId\":\"up-1\"}",
        WellnessQueues.LAB_UPLOAD_RETRY, 0);

    assertEquals(DispatchResult.failed("Task payload missing uploadId or userId."), handler().handle("lab-2"));
    assertTrue(applied.isEmpty());
  }

  @Test
  void unknownUploadThrows() {
    LabUploadNotFoundException e = assertThrows(LabUploadNotFoundException.class, () -> handler().handle("lab-1"));
    assertEquals("Upload up-1 not found for user u1", e.getMessage());
  }

  @Test
  void binaryContentIsDecodedAsLatin1() {
    assertEquals(StandardCharsets.UTF_8, LabIngestionHandler.charsetFor(null));
    assertEquals(StandardCharsets.UTF_8, LabIngestionHandler.charsetFor("application/json"));
    assertEquals(StandardCharsets.UTF_8, LabIngestionHandler.charsetFor("text/plain"));
    assertEquals(StandardCharsets.ISO_8859_1, LabIngestionHandler.charsetFor("application/octet-stream"));
  }

  private static final class MemoryStorage implements ArtifactStorage {
    final Map<String, byte[]> objects = new HashMap<>();
    final Map<String, Map<String, String>> metadata = new HashMap<>();

    @Override
    public byte[] download(String key) {
      byte[] content = objects.get(key);
      if (content == null) {
        throw new IllegalArgumentException("No object at " + key);
      }
      return content;
    }

    @Override
    public void save(String key, byte[] content, String contentType, Map<String, String> objectMetadata) {
      objects.put(key, content);
      metadata.put(key, objectMetadata);
    }
  }
}
