package eventjournal.aggregate;

import eventjournal.StorageFailureException;
import eventjournal.model.Snapshot;
import eventjournal.spi.ConnectionProvider;
import eventjournal.spi.MetricsExporter;
import eventjournal.spi.SnapshotStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection-managing front of the {@link SnapshotStore}: saves and loads the current
 * snapshot of a stream in auto-commit mode.
 */
public final class SnapshotManager {
  private static final Logger logger = Logger.getLogger(SnapshotManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SnapshotStore store;
  private final MetricsExporter metrics;
  private final Clock clock;

  public SnapshotManager(ConnectionProvider connectionProvider, SnapshotStore store) {
    this(connectionProvider, store, MetricsExporter.NOOP, Clock.systemUTC());
  }

  public SnapshotManager(ConnectionProvider connectionProvider, SnapshotStore store,
      MetricsExporter metrics, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Saves {@code state} as the snapshot of {@code streamId} at {@code version}, taken now.
   *
   * @return {@code true} if it replaced the current snapshot, {@code false} if a newer
   *     one was already stored
   */
  public boolean save(String streamId, long version, byte[] state) {
    Snapshot snapshot = new Snapshot(streamId, version, state, clock.instant());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean saved = store.save(conn, snapshot);
      if (saved) {
        metrics.incrementSnapshotSaved();
        logger.log(Level.FINE, "Saved snapshot of {0} at version {1}", new Object[]{streamId, version});
      }
      return saved;
    } catch (SQLException e) {
      throw new StorageFailureException("Failed to save snapshot of " + streamId, 1, e);
    }
  }

  public Optional<Snapshot> loadLatest(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.loadLatest(conn, streamId);
    } catch (SQLException e) {
      throw new StorageFailureException("Failed to load snapshot of " + streamId, 1, e);
    }
  }

  public int delete(String streamId) {
    Objects.requireNonNull(streamId, "streamId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.delete(conn, streamId);
    } catch (SQLException e) {
      throw new StorageFailureException("Failed to delete snapshots of " + streamId, 1, e);
    }
  }

  Clock clock() {
    return clock;
  }
}
