package eventjournal.jdbc;

import eventjournal.jdbc.spi.Dialect;
import eventjournal.model.Snapshot;
import eventjournal.spi.SnapshotStore;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC snapshot store keeping one row per stream.
 */
public final class JdbcSnapshotStore extends AbstractJdbcStore implements SnapshotStore {

  public JdbcSnapshotStore(Dialect dialect) {
    this(dialect, JournalTables.withDefaultPrefix());
  }

  public JdbcSnapshotStore(Dialect dialect, JournalTables tables) {
    super(dialect, tables);
  }

  @Override
  public boolean save(Connection conn, Snapshot snapshot) {
    if (replace(conn, snapshot)) {
      return true;
    }
    if (insertIfAbsent(conn, tables.snapshot(), "stream_id, version, state, taken_at", "stream_id",
        snapshot.streamId(), snapshot.version(), snapshot.state(), ts(snapshot.takenAt()))) {
      return true;
    }
    // a concurrent writer inserted the row first
    return replace(conn, snapshot);
  }

  private boolean replace(Connection conn, Snapshot snapshot) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.snapshot() + " SET version=?, state=?, taken_at=? WHERE stream_id=? AND version<=?",
        snapshot.version(), snapshot.state(), ts(snapshot.takenAt()), snapshot.streamId(), snapshot.version()) > 0;
  }

  @Override
  public Optional<Snapshot> loadLatest(Connection conn, String streamId) {
    List<Snapshot> rows = JdbcTemplate.query(conn,
        "SELECT stream_id, version, state, taken_at FROM " + tables.snapshot() + " WHERE stream_id=?",
        rs -> new Snapshot(rs.getString("stream_id"), rs.getLong("version"), rs.getBytes("state"),
            instant(rs.getTimestamp("taken_at"))),
        streamId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int delete(Connection conn, String streamId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.snapshot() + " WHERE stream_id=?", streamId);
  }
}
