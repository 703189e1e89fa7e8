package eventjournal.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored form of an open dead-letter entry.
 *
 * <p>The queued tail is the contiguous journal range
 * {@code failedAtVersion..lastQueuedVersion}. Committed events never change, so the
 * range bounds are enough to reproduce the queued events in order.
 */
public record DeadLetterRecord(
    String projectionName,
    String streamId,
    long failedAtVersion,
    long lastQueuedVersion,
    String reason,
    Instant enqueuedAt,
    Instant updatedAt) {

  public DeadLetterRecord {
    Objects.requireNonNull(projectionName, "projectionName");
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (failedAtVersion < 1) {
      throw new IllegalArgumentException("failedAtVersion must be >= 1");
    }
    if (lastQueuedVersion < failedAtVersion) {
      throw new IllegalArgumentException("lastQueuedVersion " + lastQueuedVersion
          + " is below failedAtVersion " + failedAtVersion);
    }
  }

  public int queuedCount() {
    return Math.toIntExact(lastQueuedVersion - failedAtVersion + 1);
  }

  public DeadLetterSummary summary() {
    return new DeadLetterSummary(projectionName, streamId, failedAtVersion, queuedCount(), reason, enqueuedAt);
  }
}
