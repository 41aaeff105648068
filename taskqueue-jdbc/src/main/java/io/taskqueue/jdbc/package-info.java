/**
 * JDBC plumbing for the task queue: connection provider, SQL helper and error type.
 *
 * @see io.taskqueue.jdbc.store.JdbcTaskStores
 */
package io.taskqueue.jdbc;
