package io.taskqueue.wellness.lab;

import java.util.List;
import java.util.Objects;

/**
 * What an ingestion run recorded for an upload.
 */
public sealed interface LabIngestionOutcome {

  String INTEGRITY_MISMATCH_CODE = "INGESTION_INTEGRITY_MISMATCH";
  String INTEGRITY_MISMATCH_MESSAGE = "Uploaded file hash does not match expected value.";
  String SEALED_KEY_VERSION = "lab-seal-v1";

  /**
   * The downloaded bytes did not match the hash recorded at upload time.
   */
  record IntegrityFailure(String expectedSha256, String receivedSha256) implements LabIngestionOutcome {
    public IntegrityFailure {
      Objects.requireNonNull(expectedSha256, "expectedSha256");
      Objects.requireNonNull(receivedSha256, "receivedSha256");
    }

    public String code() {
      return INTEGRITY_MISMATCH_CODE;
    }

    public String message() {
      return INTEGRITY_MISMATCH_MESSAGE;
    }
  }

  /**
   * Parsed measurements plus the location of the sealed copy.
   */
  record Ingested(
      String summary,
      List<String> notes,
      List<LabMeasurement> measurements,
      String sealedStorageKey,
      String sealedKeyVersion
  ) implements LabIngestionOutcome {
    public Ingested {
      Objects.requireNonNull(sealedStorageKey, "sealedStorageKey");
      Objects.requireNonNull(sealedKeyVersion, "sealedKeyVersion");
      notes = notes == null ? List.of() : List.copyOf(notes);
      measurements = measurements == null ? List.of() : List.copyOf(measurements);
    }
  }
}
