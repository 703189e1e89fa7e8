package eventjournal.aggregate;

import eventjournal.model.Snapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides when a rehydrated aggregate is worth snapshotting.
 *
 * <p>A snapshot is due when at least {@code everyEvents} events were appended since
 * the last snapshot, or when the last snapshot is older than {@code maxAge}, whichever
 * comes first, and only if the stream moved past the last snapshot. A stream that was
 * never snapshotted becomes due once it holds {@code everyEvents} events.
 */
public final class SnapshotPolicy {
  public static final long DEFAULT_EVERY_EVENTS = 1000L;
  public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(10);

  private final long everyEvents;
  private final Duration maxAge;

  public SnapshotPolicy(long everyEvents, Duration maxAge) {
    if (everyEvents <= 0) {
      throw new IllegalArgumentException("everyEvents must be > 0, got: " + everyEvents);
    }
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    this.everyEvents = everyEvents;
    this.maxAge = maxAge;
  }

  public static SnapshotPolicy defaults() {
    return new SnapshotPolicy(DEFAULT_EVERY_EVENTS, DEFAULT_MAX_AGE);
  }

  /**
   * @param last           the current snapshot, or {@code null} if none
   * @param currentVersion the version the aggregate was rehydrated to
   * @param now            the current time
   * @return whether a snapshot at {@code currentVersion} should be saved
   */
  public boolean isDue(Snapshot last, long currentVersion, Instant now) {
    if (last == null) {
      return currentVersion >= everyEvents;
    }
    if (currentVersion <= last.version()) {
      return false;
    }
    if (currentVersion - last.version() >= everyEvents) {
      return true;
    }
    return Duration.between(last.takenAt(), now).compareTo(maxAge) >= 0;
  }

  public long everyEvents() {
    return everyEvents;
  }

  public Duration maxAge() {
    return maxAge;
  }
}
