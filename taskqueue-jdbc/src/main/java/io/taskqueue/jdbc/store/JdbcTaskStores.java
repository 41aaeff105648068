package io.taskqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC task stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.taskqueue.jdbc.store.AbstractJdbcTaskStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcTaskStore store = JdbcTaskStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcTaskStore store = JdbcTaskStores.detect("jdbc:postgresql://localhost/app");
 *
 * // Get by name
 * AbstractJdbcTaskStore store = JdbcTaskStores.get("mysql");
 * }</pre>
 */
public final class JdbcTaskStores {

  private static final List<AbstractJdbcTaskStore> STORES;
  private static final Map<String, AbstractJdbcTaskStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcTaskStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcTaskStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcTaskStores() {
  }

  /**
   * Returns all registered task stores.
   */
  public static List<AbstractJdbcTaskStore> all() {
    return STORES;
  }

  /**
   * Gets a task store by name.
   *
   * @param name store name (case-insensitive)
   * @return the task store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcTaskStore get(String name) {
    AbstractJdbcTaskStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown task store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the task store from a DataSource.
   *
   * @throws IllegalStateException if the DataSource metadata cannot be read
   */
  public static AbstractJdbcTaskStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect task store from DataSource", e);
    }
  }

  /**
   * Auto-detects the task store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcTaskStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcTaskStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No task store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
