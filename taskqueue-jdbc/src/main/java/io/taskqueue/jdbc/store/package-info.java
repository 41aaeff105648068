/**
 * Dialect-specific JDBC task stores and their ServiceLoader registry.
 */
package io.taskqueue.jdbc.store;
