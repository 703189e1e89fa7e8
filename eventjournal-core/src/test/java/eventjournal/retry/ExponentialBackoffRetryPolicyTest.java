package eventjournal.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptReturnsBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    // jitter is 0.5 to 1.5
    assertTrue(delay >= 50 && delay <= 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayIncreasesExponentially() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay1 = policy.computeDelayMs(1);
    long delay2 = policy.computeDelayMs(2);
    long delay3 = policy.computeDelayMs(3);

    assertTrue(delay1 >= 50 && delay1 < 150, "delay1 range: got " + delay1);
    assertTrue(delay2 >= 100 && delay2 < 300, "delay2 range: got " + delay2);
    assertTrue(delay3 >= 200 && delay3 < 600, "delay3 range: got " + delay3);
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    assertTrue(policy.computeDelayMs(10) <= 500);
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000);

    for (int attempts : new int[]{30, 31, 32, 50, 100}) {
      long delay = policy.computeDelayMs(attempts);
      assertTrue(delay > 0 && delay <= 60000, "attempt " + attempts + " gave " + delay);
    }
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(500, 100));
  }

  @Test
  void defaults() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.defaults();
    assertEquals(50, policy.baseDelayMs());
    assertEquals(2000, policy.maxDelayMs());
  }
}
