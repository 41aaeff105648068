/**
 * Task Record model and lifecycle status.
 */
package io.taskqueue.model;
