package org.skylane.workers.api.monitoring;

import java.time.Instant;

/**
 * Represents an operational error that occurred within a pipeline component.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "ITERATION_FAILED", "REPLICA_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the replica or message involved.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
