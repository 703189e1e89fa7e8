package eventjournal.spi;

import eventjournal.model.Snapshot;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence contract for aggregate snapshots. One current snapshot is kept per stream.
 */
public interface SnapshotStore {

  /**
   * Stores a snapshot and drops older ones for the same stream. A snapshot older than
   * the stored one is ignored, so the current snapshot never moves backwards.
   *
   * @param conn     the JDBC connection
   * @param snapshot the snapshot to store
   * @return {@code true} if the snapshot became the current one
   */
  boolean save(Connection conn, Snapshot snapshot);

  Optional<Snapshot> loadLatest(Connection conn, String streamId);

  /**
   * Removes every snapshot of a stream, for instance after its payloads were erased.
   */
  int delete(Connection conn, String streamId);
}
