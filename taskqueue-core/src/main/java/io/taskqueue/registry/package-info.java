/**
 * Queue-to-handler registry.
 */
package io.taskqueue.registry;
