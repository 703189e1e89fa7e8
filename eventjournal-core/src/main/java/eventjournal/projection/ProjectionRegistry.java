package eventjournal.projection;

import eventjournal.dlq.QuarantineRegistry;
import eventjournal.dlq.RedriveResult;
import eventjournal.dlq.SequenceDeadLetterQueue;
import eventjournal.journal.EventJournal;
import eventjournal.model.DeadLetterSummary;
import eventjournal.spi.CheckpointStore;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.DeadLetterStore;
import eventjournal.spi.MetricsExporter;
import eventjournal.util.StripedLocks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of named projections and their versions.
 *
 * <p>Each registered version gets its own {@link ProjectionRunner}, dead-letter queue
 * and checkpoints, keyed by the qualified name {@code <name>.v<version>}. One version
 * per name is active and serves reads; others are shadows being rebuilt. A shadow is
 * fed by the tailer like the active version and by {@link #replay}, and replaces the
 * active version on {@link #cutover} once it has caught up.
 */
public final class ProjectionRegistry {
  private static final Logger logger = Logger.getLogger(ProjectionRegistry.class.getName());

  private final ConnectionProvider connectionProvider;
  private final EventJournal journal;
  private final CheckpointStore checkpoints;
  private final DeadLetterStore deadLetterStore;
  private final StripedLocks locks;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Map<String, Slot> slots = new ConcurrentHashMap<>();

  private ProjectionRegistry(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    this.checkpoints = Objects.requireNonNull(builder.checkpoints, "checkpoints");
    this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
    this.locks = new StripedLocks(builder.lockStripes);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static String qualifiedName(String name, int version) {
    return name + ".v" + version;
  }

  /**
   * Registers version 1 of a projection as the active version.
   *
   * @throws IllegalArgumentException if the name is already registered
   */
  public ProjectionRunner register(String name, Projection projection) {
    Objects.requireNonNull(name, "name");
    if (slots.containsKey(name)) {
      throw new IllegalArgumentException("Projection already registered: " + name);
    }
    ProjectionRunner runner = newRunner(name, 1, projection);
    Slot slot = new Slot();
    slot.versions.put(1, runner);
    slot.active = 1;
    if (slots.putIfAbsent(name, slot) != null) {
      throw new IllegalArgumentException("Projection already registered: " + name);
    }
    return runner;
  }

  /**
   * Registers a shadow version of an existing projection. It receives events but does
   * not become active until {@link #cutover}.
   *
   * @throws IllegalArgumentException if the name is unknown or the version exists
   */
  public ProjectionRunner registerVersion(String name, int version, Projection projection) {
    if (version <= 0) {
      throw new IllegalArgumentException("version must be > 0");
    }
    Slot slot = slot(name);
    synchronized (slot) {
      if (slot.versions.containsKey(version) || version <= slot.retiredBelow) {
        throw new IllegalArgumentException("Version " + version + " of " + name + " already registered");
      }
      ProjectionRunner runner = newRunner(name, version, projection);
      slot.versions.put(version, runner);
      return runner;
    }
  }

  private ProjectionRunner newRunner(String name, int version, Projection projection) {
    String qualified = qualifiedName(name, version);
    SequenceDeadLetterQueue deadLetters = SequenceDeadLetterQueue.builder()
        .projectionName(qualified)
        .connectionProvider(connectionProvider)
        .store(deadLetterStore)
        .journal(journal)
        .registry(new QuarantineRegistry())
        .metrics(metrics)
        .clock(clock)
        .build();
    ProjectionRunner runner = ProjectionRunner.builder()
        .name(qualified)
        .projection(projection)
        .connectionProvider(connectionProvider)
        .checkpoints(checkpoints)
        .journal(journal)
        .deadLetters(deadLetters)
        .locks(locks)
        .metrics(metrics)
        .build();
    deadLetters.refresh();
    return runner;
  }

  /**
   * Returns the active runner of a projection.
   */
  public ProjectionRunner runner(String name) {
    Slot slot = slot(name);
    synchronized (slot) {
      return slot.versions.get(slot.active);
    }
  }

  public ProjectionRunner runner(String name, int version) {
    Slot slot = slot(name);
    synchronized (slot) {
      ProjectionRunner runner = slot.versions.get(version);
      if (runner == null) {
        throw new IllegalArgumentException("Unknown version " + version + " of projection " + name);
      }
      return runner;
    }
  }

  public int activeVersion(String name) {
    Slot slot = slot(name);
    synchronized (slot) {
      return slot.active;
    }
  }

  /**
   * Returns every live runner, active and shadow versions alike.
   */
  public List<ProjectionRunner> runners() {
    List<ProjectionRunner> runners = new ArrayList<>();
    for (Slot slot : slots.values()) {
      synchronized (slot) {
        runners.addAll(slot.versions.values());
      }
    }
    return runners;
  }

  public long replay(String name, long fromVersion) {
    return runner(name).replay(fromVersion);
  }

  public long replay(String name, int version, long fromVersion) {
    return runner(name, version).replay(fromVersion);
  }

  public boolean isCaughtUp(String name, int version) {
    return runner(name, version).isCaughtUp();
  }

  /**
   * Makes {@code version} the active version of a projection and retires every older one.
   *
   * @return the previously active version
   * @throws IllegalStateException if the version has not caught up with the journal or
   *                               has open dead-letter entries
   */
  public int cutover(String name, int version) {
    ProjectionRunner candidate = runner(name, version);
    if (!candidate.isCaughtUp()) {
      throw new IllegalStateException("Cannot cut over " + name + " to version " + version
          + ": not caught up with the journal");
    }
    Slot slot = slot(name);
    synchronized (slot) {
      int previous = slot.active;
      if (previous == version) {
        return previous;
      }
      slot.active = version;
      slot.versions.keySet().removeIf(v -> v < version);
      slot.retiredBelow = Math.max(slot.retiredBelow, version - 1);
      logger.log(Level.INFO, "Projection {0} cut over from version {1} to {2}",
          new Object[]{name, previous, version});
      return previous;
    }
  }

  public void reset(String name, int version) {
    runner(name, version).reset();
  }

  /**
   * Lists open dead-letter entries of every live runner.
   */
  public List<DeadLetterSummary> listDeadLetters() {
    List<DeadLetterSummary> summaries = new ArrayList<>();
    for (ProjectionRunner runner : runners()) {
      summaries.addAll(runner.deadLetters().list());
    }
    return summaries;
  }

  public RedriveResult redrive(String name, String streamId) {
    return runner(name).redrive(streamId);
  }

  /**
   * Reloads the quarantined sets of every live runner from storage.
   */
  public void refresh() {
    for (ProjectionRunner runner : runners()) {
      runner.deadLetters().refresh();
    }
  }

  public boolean contains(String name) {
    return slots.containsKey(name);
  }

  private Slot slot(String name) {
    Slot slot = slots.get(Objects.requireNonNull(name, "name"));
    if (slot == null) {
      throw new IllegalArgumentException("Unknown projection: " + name);
    }
    return slot;
  }

  private static final class Slot {
    private final Map<Integer, ProjectionRunner> versions = new TreeMap<>();
    private int active;
    private int retiredBelow;
  }

  /**
   * Builder for {@link ProjectionRegistry}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventJournal journal;
    private CheckpointStore checkpoints;
    private DeadLetterStore deadLetterStore;
    private int lockStripes = StripedLocks.DEFAULT_STRIPES;
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
     * <p><b>Required.</b>
     */
    public Builder journal(EventJournal journal) {
      this.journal = journal;
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
     * <p><b>Required.</b>
     */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /**
     * Sets how many per-stream locks the runners share.
     *
     * <p>Optional. Defaults to {@value StripedLocks#DEFAULT_STRIPES}.
     */
    public Builder lockStripes(int lockStripes) {
      this.lockStripes = lockStripes;
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

    public ProjectionRegistry build() {
      return new ProjectionRegistry(this);
    }
  }
}
