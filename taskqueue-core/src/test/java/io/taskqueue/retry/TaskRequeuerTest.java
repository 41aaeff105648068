package io.taskqueue.retry;

import io.taskqueue.InMemoryTaskStore;
import io.taskqueue.RetryConfig;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TaskRequeuerTest {
  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private InMemoryTaskStore store;
  private TaskRequeuer requeuer;

  @BeforeEach
  void setUp() {
    store = new InMemoryTaskStore();
    requeuer = new TaskRequeuer(InMemoryTaskStore.dummyConnections(), store,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void failTask(String name, int priorAttempts, RetryConfig retry) {
    store.insert(null, new NewTask(name, "notifications-dispatch", "{\"n\":1}", retry,
        null, "job-1", null, priorAttempts, NOW.minusSeconds(600), NOW.minusSeconds(600)));
    store.claimNext(null, "notifications-dispatch", NOW);
    store.markFailed(null, name, NOW.minusSeconds(30), "smtp timeout");
  }

  @Test
  void insertsScheduledSuccessorCarryingBookkeeping() {
    failTask("notify-1", 0, RetryConfig.of(5, 60, 900));

    assertEquals(1, requeuer.requeueFailed("notifications-dispatch", 10));

    TaskRecord failed = store.get("notify-1");
    TaskRecord successor = store.get("notify-1.retry1");
    assertEquals(TaskStatus.FAILED, failed.status());
    assertNotNull(successor);
    assertEquals(TaskStatus.PENDING, successor.status());
    assertEquals("notify-1", successor.retryOf());
    assertEquals(1, successor.attemptCount());
    assertEquals(failed.firstAttemptAt(), successor.firstAttemptAt());
    assertEquals("{\"n\":1}", successor.payloadJson());
    assertEquals("job-1", successor.jobId());
    Duration delay = Duration.between(NOW, successor.scheduleTime());
    assertTrue(delay.compareTo(Duration.ofSeconds(30)) >= 0 && delay.compareTo(Duration.ofSeconds(90)) < 0,
        "delay " + delay);
  }

  @Test
  void requeuesEachFailureOnlyOnce() {
    failTask("notify-1", 0, RetryConfig.of(5, 60, 900));

    assertEquals(1, requeuer.requeueFailed("notifications-dispatch", 10));
    assertEquals(0, requeuer.requeueFailed("notifications-dispatch", 10));
  }

  @Test
  void skipsExhaustedTasks() {
    failTask("notify-1", 2, RetryConfig.of(3, 60, 900));

    assertEquals(0, requeuer.requeueFailed("notifications-dispatch", 10));
    assertEquals(1, requeuer.count("notifications-dispatch", TaskStatus.FAILED));
  }

  @Test
  void successorOfSuccessorKeepsBaseName() {
    failTask("notify-1.retry1", 1, RetryConfig.of(5, 60, 900));

    requeuer.requeueFailed("notifications-dispatch", 10);

    assertNotNull(store.get("notify-1.retry2"));
  }

  @Test
  void findFailedListsFailures() {
    failTask("notify-1", 0, RetryConfig.DEFAULT);

    assertEquals(1, requeuer.findFailed("notifications-dispatch", 10).size());
    assertEquals("smtp timeout", requeuer.findFailed("notifications-dispatch", 10).get(0).errorMessage());
  }

  @Test
  void storeUnavailableYieldsEmptyResults() {
    TaskRequeuer unavailable = new TaskRequeuer(() -> {
      throw new SQLException("down");
    }, store);

    assertEquals(0, unavailable.requeueFailed("q", 5));
    assertEquals(0, unavailable.count("q", TaskStatus.FAILED));
    assertTrue(unavailable.findFailed("q", 5).isEmpty());
  }
}
