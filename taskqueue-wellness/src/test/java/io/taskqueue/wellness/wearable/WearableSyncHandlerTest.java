package io.taskqueue.wellness.wearable;

import io.taskqueue.DispatchResult;
import io.taskqueue.wellness.TestTasks;
import io.taskqueue.wellness.WellnessJson;
import io.taskqueue.wellness.WellnessQueues;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WearableSyncHandlerTest {

  private final TestTasks tasks = new TestTasks();
  private final List<WearableSyncPayload> synced = new ArrayList<>();
  private final WearableSyncHandler handler =
      new WearableSyncHandler(tasks, synced::add, WellnessJson.newObjectMapper());

  private String task(String payload) {
    return tasks.add("sync-" + payload.hashCode(), WellnessQueues.WEARABLE_SYNC, payload,
        WellnessQueues.WEARABLE_SYNC_RETRY, 0).name();
  }

  @Test
  void syncsCompletePayload() throws Exception {
    String name = task("{\"userId\":\"u1\",\"externalUserId\":\"ext-1\",\"reason\":\"initial-link\"}");

    assertEquals(DispatchResult.succeeded(), handler.handle(name));
    assertEquals(List.of(new WearableSyncPayload("u1", "ext-1", SyncReason.INITIAL_LINK)), synced);
  }

  @Test
  void malformedPayloadIsDroppedWithoutRetry() throws Exception {
    String missingField = task("{\"userId\":\"u1\",\"reason\":\"scheduled\"}");
    String unknownReason = task("{\"userId\":\"u1\",\"externalUserId\":\"ext-1\",\"reason\":\"cron\"}");
    String notJson = task("sync please");

    assertEquals(DispatchResult.succeeded(), handler.handle(missingField));
    assertEquals(DispatchResult.succeeded(), handler.handle(unknownReason));
    assertEquals(DispatchResult.succeeded(), handler.handle(notJson));
    assertTrue(synced.isEmpty());
  }

  @Test
  void clientFailurePropagates() {
    WearableSyncHandler failing = new WearableSyncHandler(tasks, payload -> {
      throw new IOException("vendor API unavailable");
    }, WellnessJson.newObjectMapper());
    String name = task("{\"userId\":\"u1\",\"externalUserId\":\"ext-1\",\"reason\":\"manual-retry\"}");

    IOException e = assertThrows(IOException.class, () -> failing.handle(name));
    assertEquals("vendor API unavailable", e.getMessage());
  }

  @Test
  void unknownTaskFails() throws Exception {
    assertInstanceOf(DispatchResult.Failed.class, handler.handle("missing"));
  }
}
