/**
 * Insight generation: the {@code insights-generate} producer with admission control, and
 * the handler that fails over across a pipeline of completion providers.
 */
package io.taskqueue.wellness.insight;
