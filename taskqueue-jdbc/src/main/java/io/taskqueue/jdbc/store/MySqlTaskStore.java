package io.taskqueue.jdbc.store;

import java.util.List;

/**
 * MySQL 8+ / MariaDB 10.6+ task store.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED} so concurrent workers pick different rows.
 */
public final class MySqlTaskStore extends AbstractJdbcTaskStore {

  public MySqlTaskStore() {
    super();
  }

  public MySqlTaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public AbstractJdbcTaskStore withTableName(String tableName) {
    return new MySqlTaskStore(tableName);
  }

  @Override
  protected String lockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }
}
