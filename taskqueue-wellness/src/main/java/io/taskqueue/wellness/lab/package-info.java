/**
 * Lab-report ingestion on the {@code lab-upload-ingest} queue: integrity check, sealing,
 * parsing and plan linking.
 */
package io.taskqueue.wellness.lab;
