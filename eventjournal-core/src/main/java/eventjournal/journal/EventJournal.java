package eventjournal.journal;

import eventjournal.EventEnvelope;
import eventjournal.NewEvent;
import eventjournal.StorageFailureException;
import eventjournal.VersionConflictException;
import eventjournal.model.JournalRecord;
import eventjournal.retry.ExponentialBackoffRetryPolicy;
import eventjournal.retry.RetryPolicy;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.JournalStore;
import eventjournal.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable, ordered, append-only storage of events keyed by stream id and per-stream
 * version.
 *
 * <p>{@link #append(String, long, List)} is the only write path for events. It checks
 * the caller's expected version and commits the whole batch with contiguous versions
 * or nothing at all. Transient storage failures are retried with bounded exponential
 * backoff; a {@link VersionConflictException} is never retried here, because only the
 * caller can re-decide against the newer state.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see EventStream
 */
public final class EventJournal {
  private static final Logger logger = Logger.getLogger(EventJournal.class.getName());

  public static final int DEFAULT_PAGE_SIZE = 500;
  public static final int DEFAULT_MAX_STORAGE_ATTEMPTS = 3;

  private final ConnectionProvider connectionProvider;
  private final JournalStore store;
  private final RetryPolicy retryPolicy;
  private final int maxStorageAttempts;
  private final int pageSize;
  private final MetricsExporter metrics;

  private EventJournal(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.maxStorageAttempts <= 0) {
      throw new IllegalArgumentException("maxStorageAttempts must be > 0");
    }
    if (builder.pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : ExponentialBackoffRetryPolicy.defaults();
    this.maxStorageAttempts = builder.maxStorageAttempts;
    this.pageSize = builder.pageSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Appends events to a stream in one atomic, contiguous batch.
   *
   * @param streamId        the target stream
   * @param expectedVersion the stream version the caller decided against (0 for a new stream)
   * @param events          the events to commit, in order
   * @return the committed stream version, {@code expectedVersion + events.size()}
   * @throws VersionConflictException if the stream version differs from {@code expectedVersion}
   * @throws StorageFailureException  if storage keeps failing after the retry budget
   * @throws IllegalArgumentException if the batch is empty or {@code expectedVersion} is negative
   */
  public long append(String streamId, long expectedVersion, List<NewEvent> events) {
    List<EventEnvelope> envelopes = bind(streamId, expectedVersion, events);
    long committed = withStorageRetry("append to stream " + streamId, conn -> {
      conn.setAutoCommit(false);
      try {
        store.append(conn, streamId, expectedVersion, envelopes);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn);
        throw e;
      }
      return expectedVersion + envelopes.size();
    });
    metrics.incrementAppended(envelopes.size());
    return committed;
  }

  /**
   * Appends events on a caller-managed connection.
   *
   * <p>The write joins the caller's transaction: nothing is committed or rolled back
   * here and storage failures are not retried.
   *
   * @param conn the caller's connection, usually with auto-commit disabled
   * @return the stream version after the batch, once the caller commits
   * @throws VersionConflictException if the stream version differs from {@code expectedVersion}
   */
  public long append(Connection conn, String streamId, long expectedVersion, List<NewEvent> events) {
    Objects.requireNonNull(conn, "conn");
    List<EventEnvelope> envelopes = bind(streamId, expectedVersion, events);
    try {
      store.append(conn, streamId, expectedVersion, envelopes);
    } catch (VersionConflictException e) {
      metrics.incrementAppendConflict();
      throw e;
    }
    metrics.incrementAppended(envelopes.size());
    return expectedVersion + envelopes.size();
  }

  /**
   * Reads a stream from {@code fromVersion} up to its version at the time of this call.
   *
   * <p>The returned stream is lazy and restartable; events appended after this call
   * are not included. A {@code fromVersion} of 0 or less reads from the first event.
   */
  public EventStream read(String streamId, long fromVersion) {
    Objects.requireNonNull(streamId, "streamId");
    long upTo = currentVersion(streamId);
    return new EventStream(this, streamId, Math.max(1L, fromVersion), upTo, pageSize);
  }

  /**
   * Reads the events of a stream with {@code fromVersion <= version <= toVersion}.
   */
  public EventStream read(String streamId, long fromVersion, long toVersion) {
    Objects.requireNonNull(streamId, "streamId");
    return new EventStream(this, streamId, Math.max(1L, fromVersion), toVersion, pageSize);
  }

  public long currentVersion(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    return withStorageRetry("read version of " + streamId, conn -> {
      conn.setAutoCommit(true);
      return store.currentVersion(conn, streamId);
    });
  }

  /**
   * Lists stream ids in ascending order, strictly after {@code afterStreamId}.
   *
   * @param afterStreamId the last id of the previous page, or {@code null}
   * @param limit         maximum number of ids
   */
  public List<String> streamIds(String afterStreamId, int limit) {
    requirePositive(limit);
    return withStorageRetry("list streams", conn -> {
      conn.setAutoCommit(true);
      return store.streamIds(conn, afterStreamId, limit);
    });
  }

  /**
   * Reads events of every stream in journal position order, strictly after
   * {@code afterPosition}.
   */
  public List<JournalRecord> readAll(long afterPosition, int limit) {
    requirePositive(limit);
    return withStorageRetry("read journal after position " + afterPosition, conn -> {
      conn.setAutoCommit(true);
      return store.readAll(conn, afterPosition, limit);
    });
  }

  public long headPosition() {
    return withStorageRetry("read head position", conn -> {
      conn.setAutoCommit(true);
      return store.headPosition(conn);
    });
  }

  /**
   * Crypto-shreds a stream: every payload is replaced by an empty one and flagged
   * erased. Versions, ids and timestamps are kept so ordering is unaffected.
   *
   * @return the number of events erased
   */
  public int erasePayloads(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    return withStorageRetry("erase payloads of " + streamId, conn -> {
      conn.setAutoCommit(false);
      try {
        int erased = store.erasePayloads(conn, streamId);
        conn.commit();
        return erased;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn);
        throw e;
      }
    });
  }

  public int pageSize() {
    return pageSize;
  }

  List<EventEnvelope> readPage(String streamId, long fromVersion, long toVersion, int limit) {
    return withStorageRetry("read stream " + streamId, conn -> {
      conn.setAutoCommit(true);
      return store.read(conn, streamId, fromVersion, toVersion, limit);
    });
  }

  private List<EventEnvelope> bind(String streamId, long expectedVersion, List<NewEvent> events) {
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(events, "events");
    if (streamId.isEmpty()) {
      throw new IllegalArgumentException("streamId cannot be empty");
    }
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0, got: " + expectedVersion);
    }
    if (events.isEmpty()) {
      throw new IllegalArgumentException("events cannot be empty");
    }
    List<EventEnvelope> envelopes = new ArrayList<>(events.size());
    long version = expectedVersion;
    for (NewEvent event : events) {
      envelopes.add(Objects.requireNonNull(event, "event").toEnvelope(streamId, ++version));
    }
    return envelopes;
  }

  private <T> T withStorageRetry(String operation, ConnectionCallback<T> callback) {
    int attempt = 0;
    while (true) {
      attempt++;
      try (Connection conn = connectionProvider.getConnection()) {
        return callback.doInConnection(conn);
      } catch (VersionConflictException e) {
        metrics.incrementAppendConflict();
        throw e;
      } catch (SQLException | RuntimeException e) {
        if (attempt >= maxStorageAttempts) {
          throw new StorageFailureException("Failed to " + operation, attempt, e);
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.FINE, "Retrying " + operation + " in " + delayMs + "ms after attempt " + attempt, e);
        metrics.incrementStorageRetry();
        sleep(delayMs, operation, attempt, e);
      }
    }
  }

  private static void sleep(long delayMs, String operation, int attempt, Exception cause) {
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      StorageFailureException failure = new StorageFailureException(
          "Interrupted while retrying " + operation, attempt, cause);
      failure.addSuppressed(ie);
      throw failure;
    }
  }

  private static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private static void requirePositive(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link EventJournal}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JournalStore store;
    private RetryPolicy retryPolicy;
    private int maxStorageAttempts = DEFAULT_MAX_STORAGE_ATTEMPTS;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the connection provider used for every journal operation.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the journal persistence backend.
     *
     * <p><b>Required.</b>
     *
     * @param store the journal store
     * @return this builder
     */
    public Builder store(JournalStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the backoff between storage retries.
     *
     * <p>Optional. Defaults to 50 ms base delay capped at 2 s.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how many times a storage operation is attempted before giving up.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
     *
     * @param maxStorageAttempts attempts including the first one
     * @return this builder
     */
    public Builder maxStorageAttempts(int maxStorageAttempts) {
      this.maxStorageAttempts = maxStorageAttempts;
      return this;
    }

    /**
     * Sets how many events a stream read fetches per round trip.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param pageSize events per page
     * @return this builder
     */
    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public EventJournal build() {
      return new EventJournal(this);
    }
  }
}
