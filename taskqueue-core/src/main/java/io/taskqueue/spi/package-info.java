/**
 * Service Provider Interfaces (SPI) for plugging the queue into a database and a
 * metrics backend.
 *
 * @see io.taskqueue.spi.ConnectionProvider
 * @see io.taskqueue.spi.TaskStore
 * @see io.taskqueue.spi.MetricsExporter
 */
package io.taskqueue.spi;
