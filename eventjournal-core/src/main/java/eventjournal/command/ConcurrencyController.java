package eventjournal.command;

import eventjournal.ConcurrencyExhaustedException;
import eventjournal.EventEnvelope;
import eventjournal.NewEvent;
import eventjournal.VersionConflictException;
import eventjournal.aggregate.Rehydrated;
import eventjournal.aggregate.Rehydrator;
import eventjournal.journal.EventJournal;
import eventjournal.spi.MetricsExporter;
import eventjournal.util.StripedLocks;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs commands with optimistic concurrency: rehydrate, decide, append with the
 * rehydrated version as the expected version.
 *
 * <p>When another writer got there first the append fails with a
 * {@link VersionConflictException}; the command is then decided again against freshly
 * rehydrated state. After {@code maxAttempts} conflicts the execution gives up with
 * {@link ConcurrencyExhaustedException}.
 *
 * <p>For hot streams, {@link Builder#serializeLocally} runs commands for the same stream
 * one at a time within this process, so in-process writers never conflict with each
 * other. Writers in other processes are still handled by the version check.
 *
 * @param <S> the aggregate state type
 */
public final class ConcurrencyController<S> {
  private static final Logger logger = Logger.getLogger(ConcurrencyController.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private final Rehydrator<S> rehydrator;
  private final EventJournal journal;
  private final int maxAttempts;
  private final StripedLocks locks;
  private final MetricsExporter metrics;

  private ConcurrencyController(Builder<S> builder) {
    this.rehydrator = Objects.requireNonNull(builder.rehydrator, "rehydrator");
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.locks = builder.serializeLocally ? new StripedLocks() : null;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  /**
   * Executes a command against a stream.
   *
   * @return the committed version and events
   * @throws ConcurrencyExhaustedException if every attempt hit a version conflict
   * @throws eventjournal.StorageFailureException if storage keeps failing
   */
  public CommandResult execute(String streamId, Command<S> command) {
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(command, "command");
    if (locks == null) {
      return executeWithRetry(streamId, command);
    }
    ReentrantLock lock = locks.lockFor(streamId);
    lock.lock();
    try {
      return executeWithRetry(streamId, command);
    } finally {
      lock.unlock();
    }
  }

  private CommandResult executeWithRetry(String streamId, Command<S> command) {
    VersionConflictException lastConflict = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Rehydrated<S> current = rehydrator.rehydrate(streamId);
      List<NewEvent> decided = command.decide(current.state(), current.version());
      if (decided == null || decided.isEmpty()) {
        return new CommandResult(streamId, current.version(), List.of(), attempt);
      }
      try {
        long committed = journal.append(streamId, current.version(), decided);
        return new CommandResult(streamId, committed, envelopes(streamId, current.version(), decided), attempt);
      } catch (VersionConflictException e) {
        lastConflict = e;
        logger.log(Level.FINE, "Version conflict on {0} (attempt {1} of {2})",
            new Object[]{streamId, attempt, maxAttempts});
      }
    }
    metrics.incrementCommandExhausted();
    throw new ConcurrencyExhaustedException(streamId, maxAttempts, lastConflict);
  }

  private static List<EventEnvelope> envelopes(String streamId, long expectedVersion, List<NewEvent> events) {
    List<EventEnvelope> envelopes = new ArrayList<>(events.size());
    long version = expectedVersion;
    for (NewEvent event : events) {
      envelopes.add(event.toEnvelope(streamId, ++version));
    }
    return envelopes;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Builder for {@link ConcurrencyController}.
   */
  public static final class Builder<S> {
    private Rehydrator<S> rehydrator;
    private EventJournal journal;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private boolean serializeLocally;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<S> rehydrator(Rehydrator<S> rehydrator) {
      this.rehydrator = rehydrator;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<S> journal(EventJournal journal) {
      this.journal = journal;
      return this;
    }

    /**
     * Sets how many times a command is decided before giving up on conflicts.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
     */
    public Builder<S> maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Runs commands for the same stream one at a time within this process.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder<S> serializeLocally(boolean serializeLocally) {
      this.serializeLocally = serializeLocally;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<S> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ConcurrencyController<S> build() {
      return new ConcurrencyController<>(this);
    }
  }
}
