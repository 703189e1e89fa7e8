package eventjournal.dlq;

import eventjournal.EventEnvelope;
import eventjournal.StorageFailureException;
import eventjournal.journal.EventJournal;
import eventjournal.model.DeadLetterEntry;
import eventjournal.model.DeadLetterRecord;
import eventjournal.model.DeadLetterSummary;
import eventjournal.model.StreamState;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.DeadLetterStore;
import eventjournal.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sequence-aware dead-letter queue of one projection.
 *
 * <p>When a projection fails to apply version {@code v} of stream {@code S}, the stream
 * is quarantined: an entry starting at {@code v} is opened and every later event of
 * {@code S} is deferred into it instead of being applied. Other streams are not
 * affected. The read model of {@code S} therefore never sees its events out of order;
 * it stops advancing until the tail is redriven.
 *
 * <p>The quarantined set lives in an injectable {@link QuarantineRegistry} so the
 * per-event check costs one hash lookup. Entries are written in auto-commit mode,
 * outside the read-model transaction that just rolled back.
 *
 * <p>Callers serialize operations per stream; this class only guarantees consistency
 * between storage and the registry for a single stream at a time.
 */
public final class SequenceDeadLetterQueue {
  private static final Logger logger = Logger.getLogger(SequenceDeadLetterQueue.class.getName());

  static final int MAX_REASON_LENGTH = 2000;

  private final String projectionName;
  private final ConnectionProvider connectionProvider;
  private final DeadLetterStore store;
  private final EventJournal journal;
  private final QuarantineRegistry registry;
  private final MetricsExporter metrics;
  private final Clock clock;

  private SequenceDeadLetterQueue(Builder builder) {
    this.projectionName = Objects.requireNonNull(builder.projectionName, "projectionName");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    this.registry = builder.registry != null ? builder.registry : new QuarantineRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String projectionName() {
    return projectionName;
  }

  public boolean isQuarantined(String streamId) {
    return registry.isQuarantined(streamId);
  }

  public StreamState state(String streamId) {
    return registry.isQuarantined(streamId) ? StreamState.QUARANTINED : StreamState.FLOWING;
  }

  /**
   * Quarantines the stream of {@code event} starting at its version.
   *
   * @param event the event that failed to apply
   * @param cause the failure
   * @throws StorageFailureException if the entry cannot be stored; the stream is then
   *                                 not quarantined and the event must be delivered again
   */
  public DeadLetterRecord quarantine(EventEnvelope event, Throwable cause) {
    String reason = describe(cause);
    DeadLetterRecord record = write("quarantine " + event.streamId(),
        conn -> store.quarantine(conn, projectionName, event.streamId(), event.version(), reason, clock.instant()));
    if (registry.quarantine(event.streamId())) {
      metrics.recordQuarantined(projectionName, registry.size());
    }
    metrics.incrementProjectionFailed(projectionName);
    logger.log(Level.WARNING, "Projection " + projectionName + " quarantined stream " + event.streamId()
        + " at version " + event.version() + ": " + reason, cause);
    return record;
  }

  /**
   * Defers an event of a quarantined stream by extending its entry.
   *
   * @return {@code false} if the stream has no open entry any more
   */
  public boolean defer(EventEnvelope event) {
    boolean extended = write("defer event of " + event.streamId(),
        conn -> store.extend(conn, projectionName, event.streamId(), event.version(), clock.instant()));
    if (extended) {
      metrics.incrementDeferred(projectionName);
      logger.log(Level.FINE, "Deferred {0} v{1} behind quarantine of {2}",
          new Object[]{event.streamId(), event.version(), projectionName});
    } else if (registry.release(event.streamId())) {
      metrics.recordQuarantined(projectionName, registry.size());
    }
    return extended;
  }

  /**
   * Moves the failure point of an open entry forward after a partial or cancelled redrive.
   */
  public void markFailed(String streamId, long failedAtVersion, String reason) {
    write("update dead letter of " + streamId,
        conn -> store.markFailed(conn, projectionName, streamId, failedAtVersion, truncate(reason), clock.instant()));
  }

  /**
   * Closes the entry of a stream whose queued events up to {@code lastQueuedVersion}
   * were all applied, and releases the stream.
   *
   * @return {@code false} if events were queued past {@code lastQueuedVersion} meanwhile
   */
  public boolean close(String streamId, long lastQueuedVersion) {
    boolean closed = write("close dead letter of " + streamId,
        conn -> store.close(conn, projectionName, streamId, lastQueuedVersion));
    if (closed && registry.release(streamId)) {
      metrics.recordQuarantined(projectionName, registry.size());
    }
    return closed;
  }

  /**
   * Drops a stream from the quarantined set when storage holds no entry for it.
   */
  public void releaseOrphan(String streamId) {
    if (registry.release(streamId)) {
      metrics.recordQuarantined(projectionName, registry.size());
    }
  }

  public Optional<DeadLetterRecord> record(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    return read("read dead letter of " + streamId, conn -> store.find(conn, projectionName, streamId));
  }

  /**
   * Returns the open entry of a stream with its queued events read from the journal.
   */
  public Optional<DeadLetterEntry> entry(String streamId) {
    return record(streamId).map(record -> new DeadLetterEntry(record,
        journal.read(streamId, record.failedAtVersion(), record.lastQueuedVersion()).toList()));
  }

  public List<DeadLetterSummary> list() {
    List<DeadLetterRecord> records = read("list dead letters", conn -> store.list(conn, projectionName));
    List<DeadLetterSummary> summaries = new ArrayList<>(records.size());
    for (DeadLetterRecord record : records) {
      summaries.add(record.summary());
    }
    return summaries;
  }

  /**
   * Reloads the quarantined set from storage, for instance at start-up.
   *
   * @return the number of quarantined streams
   */
  public int refresh() {
    List<DeadLetterRecord> records = read("list dead letters", conn -> store.list(conn, projectionName));
    List<String> streamIds = new ArrayList<>(records.size());
    for (DeadLetterRecord record : records) {
      streamIds.add(record.streamId());
    }
    registry.replaceAll(streamIds);
    metrics.recordQuarantined(projectionName, registry.size());
    return registry.size();
  }

  /**
   * Deletes every entry of the projection and releases all streams.
   */
  public int clear() {
    int deleted = write("clear dead letters", conn -> store.deleteAll(conn, projectionName));
    registry.clear();
    metrics.recordQuarantined(projectionName, 0);
    return deleted;
  }

  public QuarantineRegistry registry() {
    return registry;
  }

  public int quarantinedCount() {
    return registry.size();
  }

  private <T> T write(String operation, StoreCall<T> call) {
    try {
      return read(operation, call);
    } catch (StorageFailureException e) {
      logger.log(Level.SEVERE, "Projection " + projectionName + " failed to " + operation, e);
      throw e;
    }
  }

  private <T> T read(String operation, StoreCall<T> call) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return call.execute(conn);
    } catch (SQLException | RuntimeException e) {
      throw new StorageFailureException("Failed to " + operation + " for projection " + projectionName, 1, e);
    }
  }

  static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown";
    }
    String message = cause.getMessage();
    return truncate(message == null ? cause.getClass().getName() : cause.getClass().getSimpleName() + ": " + message);
  }

  private static String truncate(String reason) {
    if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
      return reason;
    }
    return reason.substring(0, MAX_REASON_LENGTH);
  }

  @FunctionalInterface
  private interface StoreCall<T> {
    T execute(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link SequenceDeadLetterQueue}.
   */
  public static final class Builder {
    private String projectionName;
    private ConnectionProvider connectionProvider;
    private DeadLetterStore store;
    private EventJournal journal;
    private QuarantineRegistry registry;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder projectionName(String projectionName) {
      this.projectionName = projectionName;
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
    public Builder store(DeadLetterStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the journal queued events are read back from.
     *
     * <p><b>Required.</b>
     */
    public Builder journal(EventJournal journal) {
      this.journal = journal;
      return this;
    }

    /**
     * Injects the quarantined-stream set shared with the projection runner.
     *
     * <p>Optional. Defaults to a new empty registry.
     */
    public Builder registry(QuarantineRegistry registry) {
      this.registry = registry;
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

    public SequenceDeadLetterQueue build() {
      return new SequenceDeadLetterQueue(this);
    }
  }
}
