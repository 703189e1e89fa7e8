package eventjournal.aggregate;

import eventjournal.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotPolicyTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private final SnapshotPolicy policy = new SnapshotPolicy(100, Duration.ofMinutes(10));

  @Test
  void firstSnapshotAfterEveryEvents() {
    assertFalse(policy.isDue(null, 99, T0));
    assertTrue(policy.isDue(null, 100, T0));
  }

  @Test
  void dueAfterEveryEventsSinceLastSnapshot() {
    Snapshot last = new Snapshot("acct-1", 100, new byte[]{1}, T0);

    assertFalse(policy.isDue(last, 150, T0.plusSeconds(1)));
    assertTrue(policy.isDue(last, 200, T0.plusSeconds(1)));
  }

  @Test
  void dueWhenSnapshotIsOlderThanMaxAge() {
    Snapshot last = new Snapshot("acct-1", 100, new byte[]{1}, T0);

    assertFalse(policy.isDue(last, 101, T0.plus(Duration.ofMinutes(9))));
    assertTrue(policy.isDue(last, 101, T0.plus(Duration.ofMinutes(10))));
  }

  @Test
  void neverDueWithoutNewEvents() {
    Snapshot last = new Snapshot("acct-1", 100, new byte[]{1}, T0);

    assertFalse(policy.isDue(last, 100, T0.plus(Duration.ofDays(1))));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new SnapshotPolicy(0, Duration.ofMinutes(1)));
    assertThrows(IllegalArgumentException.class, () -> new SnapshotPolicy(10, Duration.ZERO));
    assertThrows(NullPointerException.class, () -> new SnapshotPolicy(10, null));
  }
}
