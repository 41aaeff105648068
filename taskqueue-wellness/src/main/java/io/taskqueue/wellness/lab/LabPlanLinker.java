package io.taskqueue.wellness.lab;

import java.util.List;

/**
 * Links freshly ingested measurements to the user's active plans.
 */
@FunctionalInterface
public interface LabPlanLinker {

  LabPlanLinker NOOP = (uploadId, userId, measurements) -> { };

  void autoLink(String uploadId, String userId, List<LabMeasurement> measurements) throws Exception;
}
