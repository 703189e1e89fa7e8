package eventjournal.projection;

import eventjournal.journal.EventJournal;
import eventjournal.model.JournalRecord;
import eventjournal.spi.MetricsExporter;
import eventjournal.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled poller that reads the journal in position order and feeds every event to
 * every live projection runner.
 *
 * <p>The position is kept in memory; after a restart the tailer starts from
 * {@link Builder#startPosition} and the runners skip what their checkpoints already
 * cover. A position is only passed once all runners accepted the event, so a failing
 * cycle is retried from the same place.
 *
 * <p>Positions are assigned at insert time, so appends can commit out of position order
 * and become visible behind the tailer. Every position skipped on the way is remembered
 * as a hole and read again on each cycle until it shows up or {@link Builder#gapTimeout}
 * passes; holes left by rolled-back appends never fill and simply expire. Holes live in
 * memory only: after a restart the tailer reads from {@link Builder#startPosition} again.
 * {@link Builder#skipRecent} additionally holds back events younger than a settle window.
 *
 * <p>The {@link #start()} and {@link #close()} methods are synchronized to prevent
 * concurrent lifecycle transitions.
 */
public final class JournalTailer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JournalTailer.class.getName());
  static final Duration DEFAULT_GAP_TIMEOUT = Duration.ofSeconds(30);

  private final EventJournal journal;
  private final Supplier<List<ProjectionRunner>> runners;
  private final int batchSize;
  private final long intervalMs;
  private final Duration skipRecent;
  private final Duration gapTimeout;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Object cycleLock = new Object();
  private final TreeMap<Long, Hole> holes = new TreeMap<>();

  private volatile long position;
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private JournalTailer(Builder builder) {
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    this.runners = Objects.requireNonNull(builder.runners, "runners");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
      throw new IllegalArgumentException("skipRecent must be >= 0");
    }
    if (builder.gapTimeout != null && builder.gapTimeout.isNegative()) {
      throw new IllegalArgumentException("gapTimeout must be >= 0");
    }
    if (builder.startPosition < 0) {
      throw new IllegalArgumentException("startPosition must be >= 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.skipRecent = builder.skipRecent == null ? Duration.ZERO : builder.skipRecent;
    this.gapTimeout = builder.gapTimeout == null ? DEFAULT_GAP_TIMEOUT : builder.gapTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.position = builder.startPosition;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JournalTailer has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("journal-tailer-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single poll cycle. Called automatically by the scheduler, but may also be
   * invoked directly.
   *
   * @return the number of journal records delivered
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    synchronized (cycleLock) {
      try {
        Instant now = clock.instant();
        List<ProjectionRunner> targets = runners.get();
        int delivered = revisitHoles(targets, now);
        List<JournalRecord> records = journal.readAll(position, batchSize);
        if (records.isEmpty()) {
          metrics.recordTailerLagMs(0);
          return delivered;
        }
        Instant settledBefore = now.minus(skipRecent);
        Instant newest = null;
        for (JournalRecord record : records) {
          if (!skipRecent.isZero() && record.recordedAt().isAfter(settledBefore)) {
            break;
          }
          deliver(targets, record);
          if (record.position() > position + 1) {
            holes.put(position + 1, new Hole(position + 1, record.position() - 1, now));
          }
          position = record.position();
          newest = record.recordedAt();
          delivered++;
        }
        if (newest != null) {
          metrics.recordTailerLagMs(Math.max(0L, Duration.between(newest, now).toMillis()));
        }
        return delivered;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Tail cycle failed at position " + position, e);
        return 0;
      }
    }
  }

  private static void deliver(List<ProjectionRunner> targets, JournalRecord record) {
    for (ProjectionRunner runner : targets) {
      runner.consume(record.event());
    }
  }

  /**
   * Reads every known hole again, delivers what has committed since, and keeps the
   * positions still missing. Holes older than the gap timeout are dropped after this
   * last look.
   */
  private int revisitHoles(List<ProjectionRunner> targets, Instant now) {
    if (holes.isEmpty()) {
      return 0;
    }
    int delivered = 0;
    List<Hole> remaining = new ArrayList<>();
    for (Hole hole : new ArrayList<>(holes.values())) {
      long cursor = hole.from;
      for (JournalRecord record : journal.readAll(hole.from - 1, batchSize)) {
        if (record.position() > hole.to) {
          break;
        }
        deliver(targets, record);
        delivered++;
        if (record.position() > cursor) {
          remaining.add(new Hole(cursor, record.position() - 1, hole.since));
        }
        cursor = record.position() + 1;
      }
      if (cursor <= hole.to) {
        remaining.add(new Hole(cursor, hole.to, hole.since));
      }
    }
    holes.clear();
    for (Hole hole : remaining) {
      if (Duration.between(hole.since, now).compareTo(gapTimeout) >= 0) {
        logger.log(Level.FINE, "Journal positions {0}..{1} never committed, no longer waiting",
            new Object[]{hole.from, hole.to});
      } else {
        holes.put(hole.from, hole);
      }
    }
    return delivered;
  }

  /**
   * Returns the number of skipped position ranges still awaited.
   */
  public int pendingHoles() {
    synchronized (cycleLock) {
      return holes.size();
    }
  }

  /**
   * Polls until a cycle delivers less than a full batch.
   *
   * @return the number of journal records delivered
   */
  public long drain() {
    long total = 0;
    int delivered;
    do {
      delivered = poll();
      total += delivered;
    } while (delivered >= batchSize);
    return total;
  }

  /**
   * Returns the position of the last delivered journal record.
   */
  public long position() {
    return position;
  }

  /**
   * Cancels the polling schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
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

  private static final class Hole {
    final long from;
    final long to;
    final Instant since;

    Hole(long from, long to, Instant since) {
      this.from = from;
      this.to = to;
      this.since = since;
    }
  }

  /**
   * Builder for {@link JournalTailer}.
   */
  public static final class Builder {
    private EventJournal journal;
    private Supplier<List<ProjectionRunner>> runners;
    private int batchSize = 200;
    private long intervalMs = 1000L;
    private Duration skipRecent;
    private Duration gapTimeout;
    private long startPosition;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder journal(EventJournal journal) {
      this.journal = journal;
      return this;
    }

    /**
     * Feeds every live runner of the registry, including shadow versions.
     *
     * <p><b>Required</b> (or {@link #runners}).
     */
    public Builder registry(ProjectionRegistry registry) {
      Objects.requireNonNull(registry, "registry");
      this.runners = registry::runners;
      return this;
    }

    /**
     * Sets the runners to feed, looked up again on every cycle.
     */
    public Builder runners(Supplier<List<ProjectionRunner>> runners) {
      this.runners = runners;
      return this;
    }

    /**
     * Sets the maximum number of journal records read per poll cycle.
     *
     * <p>Optional. Defaults to {@code 200}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the polling interval in milliseconds.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets a settle window: records younger than this are left for a later cycle.
     *
     * <p>Optional. Defaults to {@link Duration#ZERO}. Must be &ge; 0.
     */
    public Builder skipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
      return this;
    }

    /**
     * Sets how long a skipped journal position is awaited before it is taken for a
     * rolled-back append.
     *
     * <p>Optional. Defaults to 30 seconds. Must be &ge; 0.
     */
    public Builder gapTimeout(Duration gapTimeout) {
      this.gapTimeout = gapTimeout;
      return this;
    }

    /**
     * Sets the journal position to start after.
     *
     * <p>Optional. Defaults to {@code 0} (the beginning of the journal).
     */
    public Builder startPosition(long startPosition) {
      this.startPosition = startPosition;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JournalTailer build() {
      return new JournalTailer(this);
    }
  }
}
