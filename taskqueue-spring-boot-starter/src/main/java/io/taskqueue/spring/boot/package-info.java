/**
 * Spring Boot auto-configuration for the task queue: JDBC store detection, annotated
 * handler registration and a lifecycle-managed worker pool.
 */
package io.taskqueue.spring.boot;
