package io.taskqueue.runner;

import io.taskqueue.DispatchResult;
import io.taskqueue.InMemoryTaskStore;
import io.taskqueue.RetryConfig;
import io.taskqueue.TaskHandler;
import io.taskqueue.model.NewTask;
import io.taskqueue.model.TaskRecord;
import io.taskqueue.model.TaskStatus;
import io.taskqueue.spi.ConnectionProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRunnerTest {
  private static final String QUEUE = "test-queue";

  private InMemoryTaskStore store;
  private RecordingMetrics metrics;
  private WorkerRunner runner;

  @BeforeEach
  void setUp() {
    store = new InMemoryTaskStore();
    metrics = new RecordingMetrics();
  }

  @AfterEach
  void tearDown() {
    if (runner != null) {
      runner.close();
    }
  }

  private void enqueue(String name, Instant scheduleTime) {
    store.insert(null, NewTask.fresh(name, QUEUE, "{}", RetryConfig.of(3, 1, 10),
        scheduleTime, null, Instant.now()));
  }

  private WorkerRunner.Builder runnerFor(TaskHandler handler) {
    return WorkerRunner.builder()
        .queue(QUEUE)
        .handler(handler)
        .connectionProvider(InMemoryTaskStore.dummyConnections())
        .taskStore(store)
        .metrics(metrics)
        .pollInterval(Duration.ofMillis(20))
        .errorBackoff(Duration.ofMillis(20))
        .drainTimeout(Duration.ofSeconds(2));
  }

  @Test
  void succeededResultMarksTaskWithBookkeeping() {
    enqueue("t-1", null);
    runner = runnerFor(name -> DispatchResult.succeeded()).build();

    assertEquals(WorkerRunner.Cycle.COMPLETED, runner.runOnce());

    TaskRecord task = store.get("t-1");
    assertEquals(TaskStatus.SUCCEEDED, task.status());
    assertEquals(1, task.attemptCount());
    assertNotNull(task.firstAttemptAt());
    assertEquals(task.firstAttemptAt(), task.lastAttemptAt());
    assertNull(task.errorMessage());
    assertEquals(1, metrics.claimed.get());
    assertEquals(1, metrics.succeeded.get());
    assertEquals(1, metrics.durations.get());
  }

  @Test
  void failedResultStoresReason() {
    enqueue("t-1", null);
    runner = runnerFor(name -> DispatchResult.failed("payload is invalid")).build();

    assertEquals(WorkerRunner.Cycle.COMPLETED, runner.runOnce());

    TaskRecord task = store.get("t-1");
    assertEquals(TaskStatus.FAILED, task.status());
    assertEquals("payload is invalid", task.errorMessage());
    assertEquals(1, task.attemptCount());
    assertEquals(1, metrics.failed.get());
  }

  @Test
  void handledResultLeavesRecordUntouched() {
    enqueue("t-1", null);
    runner = runnerFor(name -> DispatchResult.handled()).build();

    assertEquals(WorkerRunner.Cycle.COMPLETED, runner.runOnce());

    TaskRecord task = store.get("t-1");
    assertEquals(TaskStatus.DISPATCHED, task.status());
    assertEquals(0, task.attemptCount());
  }

  @Test
  void handlerExceptionIsRecordedAsRunnerFailure() {
    enqueue("t-1", null);
    runner = runnerFor(name -> {
      throw new IllegalStateException("downstream exploded");
    }).build();

    assertEquals(WorkerRunner.Cycle.ERRORED, runner.runOnce());

    TaskRecord task = store.get("t-1");
    assertEquals(TaskStatus.FAILED, task.status());
    assertEquals("downstream exploded", task.errorMessage());
    assertEquals(1, task.attemptCount());
    assertEquals(1, metrics.runnerFailures.get());
  }

  @Test
  void exceptionWithoutMessageStoresClassName() {
    enqueue("t-1", null);
    runner = runnerFor(name -> {
      throw new SQLException();
    }).build();

    runner.runOnce();

    assertEquals(SQLException.class.getName(), store.get("t-1").errorMessage());
  }

  @Test
  void handlerErrorIsRecordedOnTask() {
    enqueue("t-1", null);
    runner = runnerFor(name -> {
      throw new AssertionError("handler bug");
    }).build();

    assertEquals(WorkerRunner.Cycle.ERRORED, runner.runOnce());

    TaskRecord task = store.get("t-1");
    assertEquals(TaskStatus.FAILED, task.status());
    assertEquals("handler bug", task.errorMessage());
    assertEquals(1, task.attemptCount());
    assertEquals(1, metrics.runnerFailures.get());
  }

  @Test
  void virtualMachineErrorIsRecordedThenRethrown() {
    enqueue("t-1", null);
    runner = runnerFor(name -> {
      throw new StackOverflowError("deep");
    }).build();

    assertThrows(StackOverflowError.class, runner::runOnce);
    assertEquals(TaskStatus.FAILED, store.get("t-1").status());
    assertEquals("deep", store.get("t-1").errorMessage());
  }

  @Test
  void loopRecordsHandlerErrorAndKeepsPolling() throws InterruptedException {
    enqueue("broken", null);
    enqueue("fine", null);
    CountDownLatch processed = new CountDownLatch(2);
    runner = runnerFor(name -> {
      processed.countDown();
      if (name.equals("broken")) {
        throw new NoClassDefFoundError("io/missing/Type");
      }
      return DispatchResult.succeeded();
    }).build();

    runner.start();

    assertTrue(processed.await(5, TimeUnit.SECONDS));
    runner.close();
    assertEquals(TaskStatus.FAILED, store.get("broken").status());
    assertEquals("io/missing/Type", store.get("broken").errorMessage());
    assertEquals(TaskStatus.SUCCEEDED, store.get("fine").status());
  }

  @Test
  void nullResultIsTreatedAsFailure() {
    enqueue("t-1", null);
    runner = runnerFor(name -> null).build();

    assertEquals(WorkerRunner.Cycle.ERRORED, runner.runOnce());
    assertEquals(TaskStatus.FAILED, store.get("t-1").status());
  }

  @Test
  void emptyQueueIsIdle() {
    runner = runnerFor(name -> DispatchResult.succeeded()).build();

    assertEquals(WorkerRunner.Cycle.IDLE, runner.runOnce());
    assertEquals(1, metrics.idlePolls.get());
    assertEquals(0, metrics.claimed.get());
  }

  @Test
  void futureTaskIsNotClaimed() {
    enqueue("later", Instant.now().plusSeconds(3600));
    runner = runnerFor(name -> DispatchResult.succeeded()).build();

    assertEquals(WorkerRunner.Cycle.IDLE, runner.runOnce());
    assertEquals(TaskStatus.PENDING, store.get("later").status());
  }

  @Test
  void claimsImmediateTasksBeforeScheduledOnes() {
    enqueue("scheduled", Instant.now().minusSeconds(60));
    enqueue("immediate", null);
    List<String> seen = new ArrayList<>();
    runner = runnerFor(name -> {
      seen.add(name);
      return DispatchResult.succeeded();
    }).build();

    runner.runOnce();
    runner.runOnce();

    assertEquals(List.of("immediate", "scheduled"), seen);
  }

  @Test
  void finalAttemptFailureCountsAsExhausted() {
    store.insert(null, new NewTask("t-last", QUEUE, "{}", RetryConfig.of(3, 1, 10),
        null, null, null, 2, Instant.now(), Instant.now()));
    runner = runnerFor(name -> DispatchResult.failed("still broken")).build();

    runner.runOnce();

    assertEquals(3, store.get("t-last").attemptCount());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void claimErrorIsTreatedAsIdle() {
    ConnectionProvider failing = () -> {
      throw new SQLException("connection refused");
    };
    enqueue("t-1", null);
    runner = runnerFor(name -> DispatchResult.succeeded()).connectionProvider(failing).build();

    assertEquals(WorkerRunner.Cycle.IDLE, runner.runOnce());
    assertEquals(TaskStatus.PENDING, store.get("t-1").status());
  }

  @Test
  void loopKeepsRunningAfterHandlerThrows() throws InterruptedException {
    enqueue("boom", null);
    enqueue("fine", null);
    CountDownLatch processed = new CountDownLatch(2);
    runner = runnerFor(name -> {
      processed.countDown();
      if (name.equals("boom")) {
        throw new RuntimeException("boom");
      }
      return DispatchResult.succeeded();
    }).build();

    runner.start();

    assertTrue(processed.await(5, TimeUnit.SECONDS));
    runner.close();
    assertEquals(TaskStatus.FAILED, store.get("boom").status());
    assertEquals(TaskStatus.SUCCEEDED, store.get("fine").status());
  }

  @Test
  void handlersRunOnNamedDaemonThread() throws InterruptedException {
    enqueue("t-1", null);
    AtomicReference<Thread> worker = new AtomicReference<>();
    CountDownLatch processed = new CountDownLatch(1);
    runner = runnerFor(name -> {
      worker.set(Thread.currentThread());
      processed.countDown();
      return DispatchResult.succeeded();
    }).build();

    runner.start();

    assertTrue(processed.await(5, TimeUnit.SECONDS));
    assertEquals("taskqueue-worker-" + QUEUE, worker.get().getName());
    assertTrue(worker.get().isDaemon());
  }

  @Test
  void closeWakesSleepingLoopPromptly() {
    runner = runnerFor(name -> DispatchResult.succeeded())
        .pollInterval(Duration.ofMinutes(10))
        .build();
    runner.start();

    long start = System.nanoTime();
    runner.close();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertFalse(runner.isRunning());
    assertTrue(elapsedMs < 2000, "close took " + elapsedMs + "ms");
  }

  @Test
  void closeDoesNotInterruptInFlightHandler() throws InterruptedException {
    enqueue("slow", null);
    CountDownLatch entered = new CountDownLatch(1);
    AtomicBoolean interrupted = new AtomicBoolean();
    runner = runnerFor(name -> {
      entered.countDown();
      long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
      while (System.nanoTime() < until) {
        if (Thread.currentThread().isInterrupted()) {
          interrupted.set(true);
        }
      }
      return DispatchResult.succeeded();
    }).build();

    runner.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    runner.close();

    assertFalse(interrupted.get());
    assertEquals(TaskStatus.SUCCEEDED, store.get("slow").status());
    assertFalse(runner.isRunning());
  }

  @Test
  void closeReturnsAfterDrainTimeout() throws InterruptedException {
    enqueue("stuck", null);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    runner = runnerFor(name -> {
      entered.countDown();
      release.await();
      return DispatchResult.succeeded();
    }).drainTimeout(Duration.ofMillis(100)).build();

    runner.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    runner.close();

    assertTrue(runner.isRunning());
    assertEquals("stuck", runner.inFlightTask());
    release.countDown();
    assertTrue(runner.awaitTermination(Duration.ofSeconds(5)));
  }

  @Test
  void noClaimsAfterClose() {
    runner = runnerFor(name -> DispatchResult.succeeded()).build();
    runner.close();
    enqueue("t-1", null);

    assertEquals(WorkerRunner.Cycle.IDLE, runner.runOnce());
    assertEquals(TaskStatus.PENDING, store.get("t-1").status());
    assertThrows(IllegalStateException.class, runner::start);
  }

  @Test
  void idlePollRateIsBoundedByPollInterval() throws InterruptedException {
    runner = runnerFor(name -> DispatchResult.succeeded())
        .pollInterval(Duration.ofMillis(100))
        .build();

    runner.start();
    Thread.sleep(550);
    runner.close();

    int polls = metrics.idlePolls.get();
    assertTrue(polls >= 1 && polls <= 7, "idle polls: " + polls);
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(NullPointerException.class, () -> WorkerRunner.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> runnerFor(name -> DispatchResult.succeeded()).pollInterval(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> runnerFor(name -> DispatchResult.succeeded()).errorBackoff(Duration.ofMillis(-1)).build());
  }

  @Test
  void dispatchesTasksOneAtATime() throws InterruptedException {
    for (int i = 0; i < 5; i++) {
      enqueue("t-" + i, null);
    }
    List<String> order = Collections.synchronizedList(new ArrayList<>());
    CountDownLatch done = new CountDownLatch(5);
    runner = runnerFor(name -> {
      order.add(name);
      done.countDown();
      return DispatchResult.succeeded();
    }).build();

    runner.start();

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("t-0", "t-1", "t-2", "t-3", "t-4"), order);
  }
}
