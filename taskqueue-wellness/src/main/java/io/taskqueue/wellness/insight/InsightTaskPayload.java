package io.taskqueue.wellness.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Task Record payload of the {@code insights-generate} queue.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightTaskPayload(String jobId, String userId) {
}
