package eventjournal.util;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of reentrant locks selected by key hash.
 *
 * <p>Two keys may share a stripe, so holders must never block on another stripe while
 * holding one. Memory stays bounded regardless of how many streams are seen.
 */
public final class StripedLocks {
  public static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] locks;

  public StripedLocks() {
    this(DEFAULT_STRIPES);
  }

  public StripedLocks(int stripes) {
    if (stripes <= 0) {
      throw new IllegalArgumentException("stripes must be > 0");
    }
    this.locks = new ReentrantLock[stripes];
    for (int i = 0; i < stripes; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  public ReentrantLock lockFor(String key) {
    Objects.requireNonNull(key, "key");
    return locks[Math.floorMod(key.hashCode(), locks.length)];
  }

  public int stripes() {
    return locks.length;
  }
}
