package io.taskqueue.alert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LoggingAlertingHookTest {
  private final Logger logger = Logger.getLogger(LoggingAlertingHook.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler capture = new Handler() {
    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  };

  @BeforeEach
  void attach() {
    logger.addHandler(capture);
  }

  @AfterEach
  void detach() {
    logger.removeHandler(capture);
  }

  @Test
  void logsSevereRecordNamingTheEvent() {
    new LoggingAlertingHook().notify("notifications.dead_letter", Map.of("taskName", "n-1"));

    assertEquals(1, records.size());
    assertEquals(Level.SEVERE, records.get(0).getLevel());
    assertTrue(records.get(0).getMessage().startsWith("Alert triggered: notifications.dead_letter"));
    assertTrue(records.get(0).getMessage().contains("n-1"));
  }
}
