package eventjournal.projection;

import eventjournal.EventEnvelope;
import eventjournal.StorageFailureException;
import eventjournal.dlq.RedriveCancellation;
import eventjournal.dlq.RedriveResult;
import eventjournal.dlq.SequenceDeadLetterQueue;
import eventjournal.journal.EventJournal;
import eventjournal.model.DeadLetterRecord;
import eventjournal.model.ProjectionCheckpoint;
import eventjournal.model.StreamState;
import eventjournal.spi.CheckpointStore;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.MetricsExporter;
import eventjournal.util.StripedLocks;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds events to one {@link Projection} in per-stream version order, exactly once
 * per checkpoint.
 *
 * <p>For each consumed event of stream {@code S} at version {@code v}:
 * <ol>
 *   <li>if {@code S} is quarantined, the event is deferred into its dead-letter entry;</li>
 *   <li>if {@code v} is at or below the checkpoint, it is a duplicate and skipped;</li>
 *   <li>if versions between the checkpoint and {@code v} were never delivered, they are
 *       read from the journal and applied first;</li>
 *   <li>the projection update and the checkpoint advance commit in one transaction;</li>
 *   <li>if the update fails, the transaction rolls back and {@code S} is quarantined at
 *       {@code v}.</li>
 * </ol>
 *
 * <p>Calls for different streams run in parallel; calls for the same stream are
 * serialized by striped locks. Apply failures never propagate to the caller. A
 * {@link StorageFailureException} does propagate when the dead-letter entry itself cannot
 * be written, in which case the event must be delivered again.
 */
public final class ProjectionRunner {
  private static final Logger logger = Logger.getLogger(ProjectionRunner.class.getName());

  private final String name;
  private final Projection projection;
  private final ConnectionProvider connectionProvider;
  private final CheckpointStore checkpoints;
  private final EventJournal journal;
  private final SequenceDeadLetterQueue deadLetters;
  private final StripedLocks locks;
  private final MetricsExporter metrics;
  private final Set<String> redriving = ConcurrentHashMap.newKeySet();

  private ProjectionRunner(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.projection = Objects.requireNonNull(builder.projection, "projection");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.checkpoints = Objects.requireNonNull(builder.checkpoints, "checkpoints");
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    this.deadLetters = Objects.requireNonNull(builder.deadLetters, "deadLetters");
    if (!name.equals(deadLetters.projectionName())) {
      throw new IllegalArgumentException("Dead-letter queue belongs to " + deadLetters.projectionName()
          + ", not " + name);
    }
    this.locks = builder.locks != null ? builder.locks : new StripedLocks();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return name;
  }

  public SequenceDeadLetterQueue deadLetters() {
    return deadLetters;
  }

  public StreamState state(String streamId) {
    return deadLetters.state(streamId);
  }

  /**
   * Consumes one event.
   *
   * @throws StorageFailureException if the checkpoint cannot be read or a failure
   *                                 cannot be recorded in the dead-letter queue
   */
  public void consume(EventEnvelope event) {
    Objects.requireNonNull(event, "event");
    ReentrantLock lock = locks.lockFor(event.streamId());
    lock.lock();
    try {
      consumeLocked(event);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Consumes events in iteration order.
   */
  public void consume(Iterable<EventEnvelope> events) {
    for (EventEnvelope event : events) {
      consume(event);
    }
  }

  private void consumeLocked(EventEnvelope event) {
    String streamId = event.streamId();
    if (deadLetters.isQuarantined(streamId) && deadLetters.defer(event)) {
      return;
    }
    long checkpoint = lastApplied(streamId);
    if (event.version() <= checkpoint) {
      metrics.incrementProjectionDuplicate(name);
      return;
    }
    if (event.version() > checkpoint + 1) {
      logger.log(Level.FINE, "{0}: filling gap {1}..{2} of {3}",
          new Object[]{name, checkpoint + 1, event.version() - 1, streamId});
      for (EventEnvelope missing : journal.read(streamId, checkpoint + 1, event.version() - 1)) {
        if (!applyOrQuarantine(missing)) {
          deadLetters.defer(event);
          return;
        }
      }
    }
    applyOrQuarantine(event);
  }

  /**
   * @return {@code false} if the event failed and its stream is now quarantined
   */
  private boolean applyOrQuarantine(EventEnvelope event) {
    ApplyAttempt attempt = apply(event);
    if (attempt.failure() != null) {
      deadLetters.quarantine(event, attempt.failure());
      return false;
    }
    return true;
  }

  private ApplyAttempt apply(EventEnvelope event) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        projection.apply(conn, event);
        if (!checkpoints.advance(conn, name, event.streamId(), event.version() - 1, event.version())) {
          conn.rollback();
          metrics.incrementProjectionDuplicate(name);
          return ApplyAttempt.DUPLICATE;
        }
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn);
        return new ApplyAttempt(false, e);
      }
      metrics.incrementProjectionApplied(name);
      return ApplyAttempt.APPLIED;
    } catch (SQLException e) {
      return new ApplyAttempt(false, e);
    }
  }

  /**
   * Returns the last version of the stream this projection applied, 0 if none.
   */
  public long checkpoint(String streamId) {
    return lastApplied(Objects.requireNonNull(streamId, "streamId"));
  }

  public List<ProjectionCheckpoint> checkpoints() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return checkpoints.list(conn, name);
    } catch (SQLException | RuntimeException e) {
      throw new StorageFailureException("Failed to list checkpoints of " + name, 1, e);
    }
  }

  /**
   * Applies every journal event of the stream past the checkpoint. Does nothing for a
   * quarantined stream.
   *
   * @return the checkpoint afterwards
   */
  public long catchUp(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    if (!deadLetters.isQuarantined(streamId)) {
      consume(journal.read(streamId, lastApplied(streamId) + 1));
    }
    return lastApplied(streamId);
  }

  public RedriveResult redrive(String streamId) {
    return redrive(streamId, new RedriveCancellation());
  }

  /**
   * Re-applies the quarantined tail of a stream in ascending version order, one event at
   * a time, through the same apply path as normal consumption.
   *
   * <p>Events deferred while the redrive runs are picked up before the entry is closed.
   * On failure at version {@code k} the entry restarts at {@code k}; earlier events stay
   * applied. Cancellation is checked between events.
   */
  public RedriveResult redrive(String streamId, RedriveCancellation cancellation) {
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(cancellation, "cancellation");
    if (!redriving.add(streamId)) {
      return new RedriveResult.AlreadyRunning(streamId);
    }
    try {
      Optional<DeadLetterRecord> found = deadLetters.record(streamId);
      if (found.isEmpty()) {
        deadLetters.releaseOrphan(streamId);
        return new RedriveResult.NotQuarantined(streamId);
      }
      DeadLetterRecord entry = found.get();
      ReentrantLock lock = locks.lockFor(streamId);
      long next = Math.max(entry.failedAtVersion(), lastApplied(streamId) + 1);
      long upTo = entry.lastQueuedVersion();
      int applied = 0;
      while (true) {
        for (EventEnvelope event : journal.read(streamId, next, upTo)) {
          if (cancellation.isCancelled()) {
            deadLetters.markFailed(streamId, event.version(), entry.reason());
            logger.log(Level.INFO, "{0}: redrive of {1} cancelled before version {2}",
                new Object[]{name, streamId, event.version()});
            return new RedriveResult.Cancelled(streamId, event.version(), applied);
          }
          ApplyAttempt attempt;
          lock.lock();
          try {
            attempt = apply(event);
          } finally {
            lock.unlock();
          }
          if (attempt.failure() != null) {
            String reason = describe(attempt.failure());
            deadLetters.markFailed(streamId, event.version(), reason);
            metrics.incrementRedrivePartial(name);
            logger.log(Level.WARNING, name + ": redrive of " + streamId + " failed at version "
                + event.version() + " after " + applied + " events", attempt.failure());
            return new RedriveResult.Partial(streamId, event.version(), applied, reason);
          }
          if (attempt.applied()) {
            applied++;
          }
          next = event.version() + 1;
        }

        lock.lock();
        try {
          Optional<DeadLetterRecord> current = deadLetters.record(streamId);
          if (current.isEmpty()) {
            deadLetters.releaseOrphan(streamId);
            return new RedriveResult.Success(streamId, applied, lastApplied(streamId));
          }
          long lastQueued = current.get().lastQueuedVersion();
          if (lastQueued <= upTo && deadLetters.close(streamId, upTo)) {
            metrics.incrementRedriveSuccess(name);
            logger.log(Level.INFO, "{0}: redrive of {1} applied {2} events, stream flowing again",
                new Object[]{name, streamId, applied});
            return new RedriveResult.Success(streamId, applied, upTo);
          }
          upTo = Math.max(upTo, lastQueued);
        } finally {
          lock.unlock();
        }
      }
    } finally {
      redriving.remove(streamId);
    }
  }

  /**
   * Feeds the historical journal to the projection.
   *
   * <p>Events from {@code fromVersion} up to each stream's checkpoint are re-applied
   * without moving the checkpoint, which is safe for idempotent projections. Events past
   * the checkpoint are consumed normally. Replay never starts above the checkpoint, so no
   * unapplied event is skipped.
   *
   * @param fromVersion the first version to re-apply in every stream, 0 for all
   * @return the number of events fed
   */
  public long replay(long fromVersion) {
    long fed = 0;
    String after = null;
    int pageSize = journal.pageSize();
    while (true) {
      List<String> streamIds = journal.streamIds(after, pageSize);
      for (String streamId : streamIds) {
        fed += replayStream(streamId, fromVersion);
      }
      if (streamIds.size() < pageSize) {
        break;
      }
      after = streamIds.get(streamIds.size() - 1);
    }
    logger.log(Level.INFO, "{0}: replay from version {1} fed {2} events",
        new Object[]{name, fromVersion, fed});
    return fed;
  }

  private long replayStream(String streamId, long fromVersion) {
    long checkpoint = lastApplied(streamId);
    long start = Math.min(Math.max(1L, fromVersion), checkpoint + 1);
    long fed = 0;
    for (EventEnvelope event : journal.read(streamId, start)) {
      if (event.version() <= checkpoint) {
        if (!reapply(event)) {
          break;
        }
      } else {
        consume(event);
      }
      fed++;
    }
    return fed;
  }

  private boolean reapply(EventEnvelope event) {
    ReentrantLock lock = locks.lockFor(event.streamId());
    lock.lock();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        projection.apply(conn, event);
        conn.commit();
        return true;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn);
        logger.log(Level.WARNING, name + ": re-applying " + event.streamId() + " v" + event.version()
            + " failed, skipping the rest of the stream's replay", e);
        return false;
      }
    } catch (SQLException e) {
      throw new StorageFailureException("Failed to replay " + event.streamId() + " into " + name, 1, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether every journal stream is applied up to its current version and no
   * stream is quarantined.
   */
  public boolean isCaughtUp() {
    if (deadLetters.quarantinedCount() > 0 || !deadLetters.list().isEmpty()) {
      return false;
    }
    Map<String, Long> applied = new HashMap<>();
    for (ProjectionCheckpoint checkpoint : checkpoints()) {
      applied.put(checkpoint.streamId(), checkpoint.lastAppliedVersion());
    }
    String after = null;
    int pageSize = journal.pageSize();
    while (true) {
      List<String> streamIds = journal.streamIds(after, pageSize);
      for (String streamId : streamIds) {
        if (applied.getOrDefault(streamId, 0L) < journal.currentVersion(streamId)) {
          return false;
        }
      }
      if (streamIds.size() < pageSize) {
        return true;
      }
      after = streamIds.get(streamIds.size() - 1);
    }
  }

  /**
   * Drops the read model, every checkpoint and every dead-letter entry of this
   * projection, so that a following replay rebuilds it from scratch.
   */
  public void reset() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        projection.reset(conn);
        checkpoints.deleteAll(conn, name);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn);
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      throw new StorageFailureException("Failed to reset projection " + name, 1, e);
    }
    deadLetters.clear();
    logger.log(Level.INFO, "{0}: reset", name);
  }

  private long lastApplied(String streamId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return checkpoints.lastApplied(conn, name, streamId);
    } catch (SQLException | RuntimeException e) {
      throw new StorageFailureException("Failed to read checkpoint of " + streamId + " for " + name, 1, e);
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : failure.getClass().getSimpleName() + ": " + message;
  }

  private static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private record ApplyAttempt(boolean applied, Throwable failure) {
    static final ApplyAttempt APPLIED = new ApplyAttempt(true, null);
    static final ApplyAttempt DUPLICATE = new ApplyAttempt(false, null);
  }

  /**
   * Builder for {@link ProjectionRunner}.
   */
  public static final class Builder {
    private String name;
    private Projection projection;
    private ConnectionProvider connectionProvider;
    private CheckpointStore checkpoints;
    private EventJournal journal;
    private SequenceDeadLetterQueue deadLetters;
    private StripedLocks locks;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the checkpoint key of the projection, qualified with its version.
     *
     * <p><b>Required.</b>
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder projection(Projection projection) {
      this.projection = projection;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder checkpoints(CheckpointStore checkpoints) {
      this.checkpoints = checkpoints;
      return this;
    }

    /**
     * Sets the journal read for gap filling, redrive and replay.
     *
     * <p><b>Required.</b>
     */
    public Builder journal(EventJournal journal) {
      this.journal = journal;
      return this;
    }

    /**
     * Sets the dead-letter queue of this projection; its name must match.
     *
     * <p><b>Required.</b>
     */
    public Builder deadLetters(SequenceDeadLetterQueue deadLetters) {
      this.deadLetters = deadLetters;
      return this;
    }

    /**
     * Optional. Defaults to {@value StripedLocks#DEFAULT_STRIPES} stripes.
     */
    public Builder locks(StripedLocks locks) {
      this.locks = locks;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ProjectionRunner build() {
      return new ProjectionRunner(this);
    }
  }
}
