package io.taskqueue.wellness.insight;

/**
 * Drops a user's cached dashboard views after a new insight lands.
 */
@FunctionalInterface
public interface DashboardCacheInvalidator {

  DashboardCacheInvalidator NOOP = userId -> { };

  void invalidateUser(String userId) throws Exception;
}
