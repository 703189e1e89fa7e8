package eventjournal;

import eventjournal.aggregate.AggregateDefinition;
import eventjournal.aggregate.Rehydrator;
import eventjournal.aggregate.SnapshotManager;
import eventjournal.aggregate.SnapshotPolicy;
import eventjournal.aggregate.SnapshotScheduler;
import eventjournal.command.ConcurrencyController;
import eventjournal.dlq.RedriveResult;
import eventjournal.dlq.RedriveScheduler;
import eventjournal.journal.EventJournal;
import eventjournal.journal.EventStream;
import eventjournal.model.DeadLetterSummary;
import eventjournal.model.Snapshot;
import eventjournal.projection.JournalTailer;
import eventjournal.projection.Projection;
import eventjournal.projection.ProjectionRegistry;
import eventjournal.projection.ProjectionRunner;
import eventjournal.retry.ExponentialBackoffRetryPolicy;
import eventjournal.spi.CheckpointStore;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.DeadLetterStore;
import eventjournal.spi.JournalStore;
import eventjournal.spi.MetricsExporter;
import eventjournal.spi.SnapshotStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link EventJournal}, snapshots, command
 * execution, projections and their dead-letter queues into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Journal journal = Journal.builder()
 *     .connectionProvider(dataSource::getConnection)
 *     .stores(journalStore, snapshotStore, checkpointStore, deadLetterStore)
 *     .build()) {
 *   journal.registerProjection("balances", balances);
 *   journal.start();
 *   journal.commands(accounts).execute("acct-42", deposit(100));
 * }
 * }</pre>
 *
 * <p>Background work (journal tailer, automatic redrive, snapshot compaction) only
 * runs after {@link #start()}; {@link #tail()} delivers pending events on the calling
 * thread instead.
 */
public final class Journal implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Journal.class.getName());

  private final JournalConfig config;
  private final EventJournal eventJournal;
  private final SnapshotManager snapshots;
  private final SnapshotPolicy snapshotPolicy;
  private final ProjectionRegistry projections;
  private final JournalTailer tailer;
  private final MetricsExporter metrics;
  private final List<Rehydrator<?>> rehydrators = new CopyOnWriteArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();

  private RedriveScheduler redriveScheduler;
  private SnapshotScheduler snapshotScheduler;

  private Journal(Builder builder) {
    this.config = builder.config != null ? builder.config : new JournalConfig();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    ConnectionProvider connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");

    this.eventJournal = EventJournal.builder()
        .connectionProvider(connectionProvider)
        .store(Objects.requireNonNull(builder.journalStore, "journalStore"))
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            config.getStorageRetryBaseDelayMs(), config.getStorageRetryMaxDelayMs()))
        .maxStorageAttempts(config.getStorageMaxAttempts())
        .pageSize(config.getReadPageSize())
        .metrics(metrics)
        .build();
    this.snapshots = new SnapshotManager(connectionProvider,
        Objects.requireNonNull(builder.snapshotStore, "snapshotStore"), metrics, clock);
    this.snapshotPolicy = new SnapshotPolicy(config.getSnapshotEveryEvents(),
        Duration.ofMillis(config.getSnapshotMaxAgeMs()));
    this.projections = ProjectionRegistry.builder()
        .connectionProvider(connectionProvider)
        .journal(eventJournal)
        .checkpoints(Objects.requireNonNull(builder.checkpointStore, "checkpointStore"))
        .deadLetterStore(Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore"))
        .lockStripes(config.getLockStripes())
        .metrics(metrics)
        .clock(clock)
        .build();
    this.tailer = JournalTailer.builder()
        .journal(eventJournal)
        .registry(projections)
        .batchSize(config.getTailerBatchSize())
        .intervalMs(config.getTailerIntervalMs())
        .skipRecent(Duration.ofMillis(config.getTailerSkipRecentMs()))
        .gapTimeout(Duration.ofMillis(config.getTailerGapTimeoutMs()))
        .metrics(metrics)
        .clock(clock)
        .build();
    if (config.isRedriveEnabled()) {
      this.redriveScheduler = RedriveScheduler.builder()
          .runners(projections::runners)
          .retryPolicy(new ExponentialBackoffRetryPolicy(
              config.getRedriveBaseDelayMs(), config.getRedriveMaxDelayMs()))
          .maxAttempts(config.getRedriveMaxAttempts())
          .intervalMs(config.getRedriveIntervalMs())
          .clock(clock)
          .build();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background workers enabled in the configuration.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (config.isTailerEnabled()) {
      tailer.start();
    }
    if (redriveScheduler != null) {
      redriveScheduler.start();
    }
    if (config.isSnapshotCompactionEnabled() && !rehydrators.isEmpty()) {
      SnapshotScheduler.Builder compaction = SnapshotScheduler.builder()
          .journal(eventJournal)
          .intervalMs(config.getSnapshotCompactionIntervalMs())
          .batchSize(config.getSnapshotCompactionBatchSize());
      rehydrators.forEach(compaction::rehydrator);
      snapshotScheduler = compaction.build();
      snapshotScheduler.start();
    }
    logger.log(Level.INFO, "Journal started with {0} projection runners", projections.runners().size());
  }

  // ── Journal ──────────────────────────────────────────────────────

  /**
   * @see EventJournal#append(String, long, List)
   */
  public long append(String streamId, long expectedVersion, List<NewEvent> events) {
    return eventJournal.append(streamId, expectedVersion, events);
  }

  public long append(String streamId, long expectedVersion, NewEvent... events) {
    return eventJournal.append(streamId, expectedVersion, List.of(events));
  }

  public EventStream read(String streamId, long fromVersion) {
    return eventJournal.read(streamId, fromVersion);
  }

  public long currentVersion(String streamId) {
    return eventJournal.currentVersion(streamId);
  }

  /**
   * Returns the current snapshot of a stream, if one was taken.
   */
  public Optional<Snapshot> snapshot(String streamId) {
    return snapshots.loadLatest(streamId);
  }

  /**
   * Crypto-shreds a stream: erases its event payloads and drops its snapshots, which
   * would otherwise still hold data derived from them.
   *
   * @return the number of events erased
   */
  public int erase(String streamId) {
    int erased = eventJournal.erasePayloads(streamId);
    snapshots.delete(streamId);
    logger.log(Level.INFO, "Erased payloads of {0} events in stream {1}", new Object[]{erased, streamId});
    return erased;
  }

  // ── Aggregates ───────────────────────────────────────────────────

  /**
   * Creates a rehydrator for an aggregate. Its streams are included in snapshot
   * compaction when that is enabled.
   */
  public <S> Rehydrator<S> rehydrator(AggregateDefinition<S> aggregate) {
    Rehydrator<S> rehydrator = Rehydrator.<S>builder()
        .journal(eventJournal)
        .aggregate(aggregate)
        .snapshots(snapshots)
        .policy(snapshotPolicy)
        .build();
    rehydrators.add(rehydrator);
    return rehydrator;
  }

  public <S> ConcurrencyController<S> commands(AggregateDefinition<S> aggregate) {
    return ConcurrencyController.<S>builder()
        .rehydrator(rehydrator(aggregate))
        .journal(eventJournal)
        .maxAttempts(config.getCommandMaxAttempts())
        .serializeLocally(config.isCommandSerializeLocally())
        .metrics(metrics)
        .build();
  }

  // ── Projections ──────────────────────────────────────────────────

  public ProjectionRunner registerProjection(String name, Projection projection) {
    return projections.register(name, projection);
  }

  public ProjectionRunner registerProjectionVersion(String name, int version, Projection projection) {
    return projections.registerVersion(name, version, projection);
  }

  /**
   * Feeds the whole journal to the active version of a projection. Events already
   * covered by a checkpoint are applied again, which leaves an idempotent read model
   * unchanged; to rebuild from scratch, {@link ProjectionRegistry#reset} it first.
   *
   * @return the number of events fed
   */
  public long replay(String name) {
    return projections.replay(name, 0L);
  }

  public long replay(String name, long fromVersion) {
    return projections.replay(name, fromVersion);
  }

  public boolean isCaughtUp(String name, int version) {
    return projections.isCaughtUp(name, version);
  }

  public int cutover(String name, int version) {
    return projections.cutover(name, version);
  }

  /**
   * Delivers journal events that are not yet delivered to every projection runner, on
   * the calling thread.
   *
   * @return the number of journal records delivered
   */
  public long tail() {
    return tailer.drain();
  }

  // ── Dead letters ─────────────────────────────────────────────────

  public List<DeadLetterSummary> listDeadLetters() {
    return projections.listDeadLetters();
  }

  /**
   * Redrives a stream in every projection that has it quarantined.
   *
   * @return the first result that is not a success, otherwise the last success;
   *     {@link RedriveResult.NotQuarantined} if no projection has the stream quarantined
   */
  public RedriveResult redrive(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    RedriveResult outcome = new RedriveResult.NotQuarantined(streamId);
    boolean failed = false;
    for (ProjectionRunner runner : projections.runners()) {
      if (!runner.deadLetters().isQuarantined(streamId)) {
        continue;
      }
      RedriveResult result = runner.redrive(streamId);
      resetAutomaticRedrive(runner, streamId);
      if (!failed && !(result instanceof RedriveResult.NotQuarantined)) {
        outcome = result;
        failed = !(result instanceof RedriveResult.Success);
      }
    }
    return outcome;
  }

  /**
   * Redrives a stream in the active version of one projection.
   */
  public RedriveResult redrive(String projectionName, String streamId) {
    ProjectionRunner runner = projections.runner(projectionName);
    RedriveResult result = runner.redrive(streamId);
    resetAutomaticRedrive(runner, streamId);
    return result;
  }

  /**
   * An operator redrive gives a stream that automatic redrive gave up on a fresh set of
   * attempts.
   */
  private void resetAutomaticRedrive(ProjectionRunner runner, String streamId) {
    if (redriveScheduler != null) {
      redriveScheduler.reset(runner.name(), streamId);
    }
  }

  /**
   * Returns the automatic redrive scheduler, present when redrive is enabled in the
   * configuration.
   */
  public Optional<RedriveScheduler> redriveScheduler() {
    return Optional.ofNullable(redriveScheduler);
  }

  // ── Components ───────────────────────────────────────────────────

  public EventJournal eventJournal() {
    return eventJournal;
  }

  public ProjectionRegistry projections() {
    return projections;
  }

  public SnapshotManager snapshots() {
    return snapshots;
  }

  public JournalConfig config() {
    return config;
  }

  /**
   * Shuts down background workers in order: snapshot compaction, redrive, tailer.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable worker : new AutoCloseable[]{snapshotScheduler, redriveScheduler, tailer, metricsCloseable()}) {
      if (worker == null) {
        continue;
      }
      try {
        worker.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new JournalException("Failed to close " + worker, e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private AutoCloseable metricsCloseable() {
    return metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  /**
   * Builder for {@link Journal}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JournalStore journalStore;
    private SnapshotStore snapshotStore;
    private CheckpointStore checkpointStore;
    private DeadLetterStore deadLetterStore;
    private JournalConfig config;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets all four stores at once.
     *
     * <p><b>Required</b> (or each store individually).
     */
    public Builder stores(JournalStore journalStore, SnapshotStore snapshotStore,
        CheckpointStore checkpointStore, DeadLetterStore deadLetterStore) {
      this.journalStore = journalStore;
      this.snapshotStore = snapshotStore;
      this.checkpointStore = checkpointStore;
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    public Builder journalStore(JournalStore journalStore) {
      this.journalStore = journalStore;
      return this;
    }

    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    public Builder checkpointStore(CheckpointStore checkpointStore) {
      this.checkpointStore = checkpointStore;
      return this;
    }

    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /**
     * Optional. Defaults to a {@link JournalConfig} with default values.
     */
    public Builder config(JournalConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the journal if it
     * is {@link AutoCloseable}.
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

    public Journal build() {
      return new Journal(this);
    }
  }
}
