package io.taskqueue.wellness.lab;

import java.util.List;
import java.util.Objects;

/**
 * A marker value extracted from a lab report.
 *
 * @param biomarkerId catalogue id when the marker was recognised, otherwise {@code null}
 * @param confidence  parser confidence in [0, 1], or {@code null}
 */
public record LabMeasurement(
    String markerName,
    String biomarkerId,
    Double value,
    String unit,
    Double confidence,
    List<String> flags
) {

  public LabMeasurement {
    Objects.requireNonNull(markerName, "markerName");
    flags = flags == null ? List.of() : List.copyOf(flags);
  }
}
