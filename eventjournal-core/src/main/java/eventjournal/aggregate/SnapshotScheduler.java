package eventjournal.aggregate;

import eventjournal.journal.EventJournal;
import eventjournal.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background compaction job that keeps snapshots fresh for streams nobody is
 * currently commanding.
 *
 * <p>Each cycle visits the next {@code batchSize} stream ids of the journal, in id
 * order, and rehydrates each one with every registered {@link Rehydrator} whose
 * aggregate owns the stream. Rehydration saves a snapshot when the policy says one is
 * due. After the last page the walk starts over from the first stream.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 */
public final class SnapshotScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SnapshotScheduler.class.getName());

  private final EventJournal journal;
  private final List<Rehydrator<?>> rehydrators;
  private final long intervalMs;
  private final int batchSize;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;
  private final Object cycleLock = new Object();
  private String cursor;

  private SnapshotScheduler(Builder builder) {
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    if (builder.rehydrators.isEmpty()) {
      throw new IllegalArgumentException("At least one rehydrator is required");
    }
    if (builder.intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.rehydrators = List.copyOf(builder.rehydrators);
    this.intervalMs = builder.intervalMs;
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SnapshotScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("journal-snapshot-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single compaction cycle. Called automatically by the scheduler, but may
   * also be invoked directly.
   *
   * @return the number of streams visited
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    synchronized (cycleLock) {
      try {
        List<String> streamIds = journal.streamIds(cursor, batchSize);
        for (String streamId : streamIds) {
          compact(streamId);
        }
        cursor = streamIds.size() < batchSize ? null : streamIds.get(streamIds.size() - 1);
        return streamIds.size();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Snapshot compaction cycle failed", e);
        return 0;
      }
    }
  }

  private void compact(String streamId) {
    for (Rehydrator<?> rehydrator : rehydrators) {
      if (!rehydrator.aggregate().owns(streamId)) {
        continue;
      }
      try {
        rehydrator.rehydrate(streamId);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to compact stream " + streamId
            + " as " + rehydrator.aggregate().name(), e);
      }
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

  /**
   * Builder for {@link SnapshotScheduler}.
   */
  public static final class Builder {
    private EventJournal journal;
    private final List<Rehydrator<?>> rehydrators = new ArrayList<>();
    private long intervalMs = 60_000L;
    private int batchSize = 100;

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
     * Adds a rehydrator whose aggregate streams should be compacted.
     *
     * <p><b>Required</b> at least once.
     */
    public Builder rehydrator(Rehydrator<?> rehydrator) {
      this.rehydrators.add(Objects.requireNonNull(rehydrator, "rehydrator"));
      return this;
    }

    /**
     * Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets how many streams a cycle visits.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public SnapshotScheduler build() {
      return new SnapshotScheduler(this);
    }
  }
}
