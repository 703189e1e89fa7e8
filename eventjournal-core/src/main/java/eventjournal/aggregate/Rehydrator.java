package eventjournal.aggregate;

import eventjournal.EventEnvelope;
import eventjournal.journal.EventJournal;
import eventjournal.model.Snapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds aggregate state from the latest snapshot plus the events that follow it.
 *
 * <p>The fold runs the aggregate's {@link EventHandlers} and nothing else, so the
 * result depends only on the journal contents: rehydrating from a snapshot gives the
 * same state as folding the whole stream. A snapshot that cannot be loaded or decoded
 * is ignored and the stream is replayed from version 1.
 *
 * <p>After folding, the {@link SnapshotPolicy} is consulted and a snapshot is saved if
 * due. Snapshot write failures are logged and never fail the rehydration.
 *
 * @param <S> the aggregate state type
 */
public final class Rehydrator<S> {
  private static final Logger logger = Logger.getLogger(Rehydrator.class.getName());

  private final EventJournal journal;
  private final AggregateDefinition<S> aggregate;
  private final SnapshotManager snapshots;
  private final SnapshotPolicy policy;

  private Rehydrator(Builder<S> builder) {
    this.journal = Objects.requireNonNull(builder.journal, "journal");
    this.aggregate = Objects.requireNonNull(builder.aggregate, "aggregate");
    this.snapshots = builder.snapshots;
    this.policy = builder.policy != null ? builder.policy : SnapshotPolicy.defaults();
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  public Rehydrated<S> rehydrate(String streamId) {
    return rehydrate(streamId, true);
  }

  /**
   * Rehydrates a stream.
   *
   * @param streamId         the stream
   * @param snapshotsEnabled {@code false} forces a full replay and skips snapshot writes
   * @return the folded state and the version it represents
   * @throws IllegalStateException if the stream holds an event type the aggregate has no
   *                               handler for
   */
  public Rehydrated<S> rehydrate(String streamId, boolean snapshotsEnabled) {
    Objects.requireNonNull(streamId, "streamId");
    boolean useSnapshots = snapshotsEnabled && snapshots != null && aggregate.snapshotsSupported();

    Snapshot snapshot = useSnapshots ? loadSnapshot(streamId) : null;
    S state = null;
    long version = 0L;
    if (snapshot != null) {
      state = decode(snapshot);
      if (state == null) {
        snapshot = null;
      } else {
        version = snapshot.version();
      }
    }
    long snapshotVersion = version;
    if (state == null) {
      state = aggregate.initialState();
    }

    for (EventEnvelope event : journal.read(streamId, version + 1)) {
      if (event.version() != version + 1) {
        throw new IllegalStateException("Stream " + streamId + " skips from version " + version
            + " to " + event.version());
      }
      state = aggregate.apply(state, event);
      version = event.version();
    }

    if (useSnapshots && policy.isDue(snapshot, version, snapshots.clock().instant())) {
      saveSnapshot(streamId, version, state);
    }
    return new Rehydrated<>(streamId, state, version, snapshotVersion);
  }

  public AggregateDefinition<S> aggregate() {
    return aggregate;
  }

  private Snapshot loadSnapshot(String streamId) {
    try {
      Optional<Snapshot> latest = snapshots.loadLatest(streamId);
      return latest.orElse(null);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Could not load snapshot of " + streamId + ", replaying full stream", e);
      return null;
    }
  }

  private S decode(Snapshot snapshot) {
    try {
      return aggregate.codec().decode(snapshot.state());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Ignoring unreadable snapshot of " + snapshot.streamId()
          + " at version " + snapshot.version(), e);
      return null;
    }
  }

  private void saveSnapshot(String streamId, long version, S state) {
    try {
      snapshots.save(streamId, version, aggregate.codec().encode(state));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to snapshot " + streamId + " at version " + version, e);
    }
  }

  /**
   * Builder for {@link Rehydrator}.
   */
  public static final class Builder<S> {
    private EventJournal journal;
    private AggregateDefinition<S> aggregate;
    private SnapshotManager snapshots;
    private SnapshotPolicy policy;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<S> journal(EventJournal journal) {
      this.journal = journal;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<S> aggregate(AggregateDefinition<S> aggregate) {
      this.aggregate = aggregate;
      return this;
    }

    /**
     * Sets where snapshots are read from and written to.
     *
     * <p>Optional. Without it every rehydration replays the full stream.
     */
    public Builder<S> snapshots(SnapshotManager snapshots) {
      this.snapshots = snapshots;
      return this;
    }

    /**
     * Optional. Defaults to {@link SnapshotPolicy#defaults()}.
     */
    public Builder<S> policy(SnapshotPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Rehydrator<S> build() {
      return new Rehydrator<>(this);
    }
  }
}
