package io.taskqueue.enqueue;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Default task name generation: {@code <queue>-<discriminator>-<epochMillis>}.
 *
 * <p>The discriminator is usually a caller key such as a user id; when none is given a
 * short random token keeps names from colliding within the same millisecond.
 */
public final class TaskNames {

  private TaskNames() {}

  public static String generate(String queue, String discriminator, Instant now) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(now, "now");
    String key = discriminator == null || discriminator.isBlank()
        ? randomToken()
        : discriminator.trim();
    return queue + "-" + key + "-" + now.toEpochMilli();
  }

  /**
   * Name of the successor that re-queues {@code failedTaskName} after {@code attempt}
   * completed attempts.
   */
  public static String retryOf(String failedTaskName, int attempt) {
    String base = failedTaskName;
    int marker = base.lastIndexOf(".retry");
    if (marker > 0) {
      base = base.substring(0, marker);
    }
    return base + ".retry" + attempt;
  }

  private static String randomToken() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
