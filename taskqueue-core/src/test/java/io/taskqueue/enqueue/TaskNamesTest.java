package io.taskqueue.enqueue;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskNamesTest {
  private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_000L);

  @Test
  void usesDiscriminatorAndEpochMillis() {
    assertEquals("insights-generate-user-7-1700000000000",
        TaskNames.generate("insights-generate", "user-7", NOW));
  }

  @Test
  void randomTokenWhenDiscriminatorMissing() {
    String first = TaskNames.generate("q", null, NOW);
    String second = TaskNames.generate("q", "  ", NOW);

    assertTrue(first.matches("q-[0-9a-f]{8}-1700000000000"), first);
    assertNotEquals(first, second);
  }

  @Test
  void retryNamesDoNotNest() {
    assertEquals("task.retry1", TaskNames.retryOf("task", 1));
    assertEquals("task.retry2", TaskNames.retryOf("task.retry1", 2));
  }
}
