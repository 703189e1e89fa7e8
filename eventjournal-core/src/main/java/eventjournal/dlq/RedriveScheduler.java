package eventjournal.dlq;

import eventjournal.projection.ProjectionRunner;
import eventjournal.retry.ExponentialBackoffRetryPolicy;
import eventjournal.retry.RetryPolicy;
import eventjournal.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Optional automatic redrive of quarantined streams.
 *
 * <p>Each cycle redrives every quarantined stream whose backoff has elapsed. A stream
 * that keeps failing is retried with exponential backoff up to {@code maxAttempts}
 * times; after that it is left quarantined for an operator and logged once. Attempt
 * counts are kept in memory and reset when the stream recovers or an operator redrives
 * it through {@link #reset}.
 *
 * <p>Redrive is operator-triggered unless this scheduler is started.
 */
public final class RedriveScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RedriveScheduler.class.getName());

  private final Supplier<List<ProjectionRunner>> runners;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final long intervalMs;
  private final Clock clock;
  private final Object cycleLock = new Object();
  private final Map<String, Backoff> backoffs = new ConcurrentHashMap<>();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private RedriveScheduler(Builder builder) {
    this.runners = Objects.requireNonNull(builder.runners, "runners");
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (builder.intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(1_000L, 300_000L);
    this.maxAttempts = builder.maxAttempts;
    this.intervalMs = builder.intervalMs;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RedriveScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("journal-redrive-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single redrive cycle.
   *
   * @return the number of streams that recovered
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    synchronized (cycleLock) {
      int recovered = 0;
      Set<String> quarantined = new HashSet<>();
      try {
        for (ProjectionRunner runner : runners.get()) {
          for (String streamId : runner.deadLetters().registry().streams()) {
            String key = runner.name() + '/' + streamId;
            quarantined.add(key);
            if (redriveIfDue(runner, streamId, key)) {
              recovered++;
            }
          }
        }
        backoffs.keySet().retainAll(quarantined);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Redrive cycle failed", e);
      }
      return recovered;
    }
  }

  private boolean redriveIfDue(ProjectionRunner runner, String streamId, String key) {
    Backoff backoff = backoffs.computeIfAbsent(key, k -> new Backoff());
    Instant now = clock.instant();
    if (backoff.attempts >= maxAttempts || now.isBefore(backoff.nextAt)) {
      return false;
    }
    RedriveResult result;
    try {
      result = runner.redrive(streamId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Automatic redrive of " + key + " failed", e);
      recordFailure(key, backoff, now);
      return false;
    }
    if (result instanceof RedriveResult.Success || result instanceof RedriveResult.NotQuarantined) {
      backoffs.remove(key);
      return result instanceof RedriveResult.Success;
    }
    if (result instanceof RedriveResult.Partial) {
      recordFailure(key, backoff, now);
    }
    return false;
  }

  private void recordFailure(String key, Backoff backoff, Instant now) {
    backoff.attempts++;
    backoff.nextAt = now.plusMillis(retryPolicy.computeDelayMs(backoff.attempts));
    if (backoff.attempts >= maxAttempts) {
      logger.log(Level.WARNING, "Giving up automatic redrive of {0} after {1} attempts; operator redrive required",
          new Object[]{key, backoff.attempts});
    }
  }

  /**
   * Forgets the failed attempts of a stream, so it is retried automatically again from
   * the next cycle with a fresh backoff. Called after an operator redrive.
   */
  public void reset(String runnerName, String streamId) {
    if (backoffs.remove(runnerName + '/' + streamId) != null) {
      logger.log(Level.FINE, "Automatic redrive attempts of {0}/{1} reset", new Object[]{runnerName, streamId});
    }
  }

  /**
   * Returns the number of failed automatic attempts recorded for a stream of a runner.
   */
  public int attempts(String runnerName, String streamId) {
    synchronized (cycleLock) {
      Backoff backoff = backoffs.get(runnerName + '/' + streamId);
      return backoff == null ? 0 : backoff.attempts;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static final class Backoff {
    private int attempts;
    private Instant nextAt = Instant.MIN;
  }

  /**
   * Builder for {@link RedriveScheduler}.
   */
  public static final class Builder {
    private Supplier<List<ProjectionRunner>> runners;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private long intervalMs = 30_000L;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the runners whose quarantined streams are redriven, looked up on every cycle.
     *
     * <p><b>Required.</b>
     */
    public Builder runners(Supplier<List<ProjectionRunner>> runners) {
      this.runners = runners;
      return this;
    }

    /**
     * Optional. Defaults to 1 s base delay capped at 5 min.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how many failed redrives a stream gets before it is left for an operator.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RedriveScheduler build() {
      return new RedriveScheduler(this);
    }
  }
}
