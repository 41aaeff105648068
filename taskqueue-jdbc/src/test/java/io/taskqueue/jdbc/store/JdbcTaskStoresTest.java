package io.taskqueue.jdbc.store;

import io.taskqueue.jdbc.H2Databases;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskStoresTest {

  @Test
  void allDialectsAreRegistered() {
    assertEquals(3, JdbcTaskStores.all().size());
    assertInstanceOf(H2TaskStore.class, JdbcTaskStores.get("h2"));
    assertInstanceOf(MySqlTaskStore.class, JdbcTaskStores.get("MySQL"));
    assertInstanceOf(PostgresTaskStore.class, JdbcTaskStores.get("postgresql"));
  }

  @Test
  void unknownNameIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcTaskStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectsFromJdbcUrl() {
    assertEquals("postgresql", JdbcTaskStores.detect("jdbc:postgresql://db/wellness").name());
    assertEquals("mysql", JdbcTaskStores.detect("jdbc:mysql://db/wellness").name());
    assertEquals("mysql", JdbcTaskStores.detect("jdbc:mariadb://db/wellness").name());
    assertEquals("h2", JdbcTaskStores.detect("JDBC:H2:mem:test").name());
  }

  @Test
  void detectRejectsUnsupportedUrls() {
    assertThrows(IllegalArgumentException.class, () -> JdbcTaskStores.detect("jdbc:sqlite:x.db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcTaskStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcTaskStores.detect((String) null));
  }

  @Test
  void detectsFromDataSource() throws Exception {
    assertEquals("h2", JdbcTaskStores.detect(H2Databases.withTaskSchema("detect")).name());
  }
}
