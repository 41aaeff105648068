package io.taskqueue.enqueue;

import io.taskqueue.InMemoryTaskStore;
import io.taskqueue.RetryConfig;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TaskEnqueuerTest {
  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private InMemoryTaskStore store;
  private TaskEnqueuer enqueuer;

  @BeforeEach
  void setUp() {
    store = new InMemoryTaskStore();
    enqueuer = TaskEnqueuer.builder()
        .connectionProvider(InMemoryTaskStore.dummyConnections())
        .taskStore(store)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  @Test
  void insertsPendingTaskWithZeroAttempts() throws SQLException {
    String name = enqueuer.enqueue("wearable-sync", "{\"userId\":\"u1\"}",
        EnqueueOptions.none().withDiscriminator("u1"));

    assertEquals("wearable-sync-u1-" + NOW.toEpochMilli(), name);
    TaskRecord task = store.get(name);
    assertEquals(TaskStatus.PENDING, task.status());
    assertEquals(0, task.attemptCount());
    assertNull(task.scheduleTime());
    assertEquals(RetryConfig.DEFAULT, task.retryConfig());
    assertEquals(NOW, task.createdAt());
  }

  @Test
  void usesExplicitNameScheduleAndJob() throws SQLException {
    Instant later = NOW.plusSeconds(300);
    enqueuer.enqueue("insights-generate", "{}", EnqueueOptions.none()
        .withTaskName("custom-name")
        .withScheduleTime(later)
        .withJobId("job-9"));

    TaskRecord task = store.get("custom-name");
    assertEquals(later, task.scheduleTime());
    assertEquals("job-9", task.jobId());
  }

  @Test
  void duplicateNameIsRejected() throws SQLException {
    EnqueueOptions options = EnqueueOptions.none().withTaskName("same");
    enqueuer.enqueue("q", "{}", options);

    DuplicateTaskException e = assertThrows(DuplicateTaskException.class,
        () -> enqueuer.enqueue("q", "{}", options));
    assertEquals("same", e.taskName());
    assertEquals(1, store.all().size());
  }

  @Test
  void payloadIsStoredVerbatim() throws SQLException {
    String name = enqueuer.enqueue("q", "not even json", null);

    assertEquals("not even json", store.get(name).payloadJson());
  }

  @Test
  void taskQueueAppliesItsRetryConfig() throws SQLException {
    TaskQueue queue = new TaskQueue("lab-upload-ingest", RetryConfig.of(3, 120, 1800), enqueuer);

    String name = queue.enqueue("{}", EnqueueOptions.none().withRetryConfig(RetryConfig.DEFAULT));

    assertTrue(name.startsWith("lab-upload-ingest-"));
    assertEquals(RetryConfig.of(3, 120, 1800), store.get(name).retryConfig());
  }

  @Test
  void connectionlessEnqueueRequiresProvider() {
    TaskEnqueuer noProvider = TaskEnqueuer.builder().taskStore(store).build();

    assertThrows(IllegalStateException.class, () -> noProvider.enqueue("q", "{}", null));
  }
}
