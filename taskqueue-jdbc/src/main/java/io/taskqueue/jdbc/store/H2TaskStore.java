package io.taskqueue.jdbc.store;

import java.util.List;

/**
 * H2 task store. Primarily for testing.
 *
 * <p>Uses the default {@code SELECT ... FOR UPDATE} claim: concurrent claimers block on
 * the locked row and lose the guarded update instead of skipping ahead.
 */
public final class H2TaskStore extends AbstractJdbcTaskStore {

  public H2TaskStore() {
    super();
  }

  public H2TaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcTaskStore withTableName(String tableName) {
    return new H2TaskStore(tableName);
  }
}
