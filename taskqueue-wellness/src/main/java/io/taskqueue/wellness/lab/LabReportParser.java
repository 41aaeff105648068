package io.taskqueue.wellness.lab;

import java.util.List;
import java.util.Objects;

/**
 * Extracts measurements from the text of a lab report.
 */
@FunctionalInterface
public interface LabReportParser {

  Result parse(String text, String contentType) throws Exception;

  /**
   * @param notes reviewer notes produced while parsing
   */
  record Result(String summary, List<String> notes, List<LabMeasurement> measurements) {
    public Result {
      Objects.requireNonNull(summary, "summary");
      notes = notes == null ? List.of() : List.copyOf(notes);
      measurements = measurements == null ? List.of() : List.copyOf(measurements);
    }
  }
}
