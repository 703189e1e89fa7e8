package eventjournal.model;

import java.time.Instant;

/**
 * One row of the dead-letter listing shown to operators.
 */
public record DeadLetterSummary(
    String projectionName,
    String streamId,
    long failedAtVersion,
    int queuedCount,
    String reason,
    Instant enqueuedAt) {
}
