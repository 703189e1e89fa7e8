package eventjournal.jdbc;

import eventjournal.jdbc.spi.Dialect;
import eventjournal.model.ProjectionCheckpoint;
import eventjournal.spi.CheckpointStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * JDBC checkpoint store. {@link #advance} is a conditional update, or an insert for the
 * first checkpoint of a stream; either runs on the projection's transaction.
 */
public final class JdbcCheckpointStore extends AbstractJdbcStore implements CheckpointStore {

  public JdbcCheckpointStore(Dialect dialect) {
    this(dialect, JournalTables.withDefaultPrefix());
  }

  public JdbcCheckpointStore(Dialect dialect, JournalTables tables) {
    super(dialect, tables);
  }

  @Override
  public long lastApplied(Connection conn, String projectionName, String streamId) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT last_applied_version FROM " + tables.checkpoint() + " WHERE projection_name=? AND stream_id=?",
        0L, projectionName, streamId);
  }

  @Override
  public boolean advance(Connection conn, String projectionName, String streamId, long expectedVersion,
      long newVersion) {
    if (newVersion <= expectedVersion) {
      throw new IllegalArgumentException("newVersion " + newVersion + " must exceed " + expectedVersion);
    }
    if (expectedVersion == 0) {
      return insertIfAbsent(conn, tables.checkpoint(),
          "projection_name, stream_id, last_applied_version, updated_at", "projection_name, stream_id",
          projectionName, streamId, newVersion, ts(Instant.now()));
    }
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.checkpoint() + " SET last_applied_version=?, updated_at=?"
            + " WHERE projection_name=? AND stream_id=? AND last_applied_version=?",
        newVersion, ts(Instant.now()), projectionName, streamId, expectedVersion) > 0;
  }

  @Override
  public List<ProjectionCheckpoint> list(Connection conn, String projectionName) {
    return JdbcTemplate.query(conn,
        "SELECT projection_name, stream_id, last_applied_version FROM " + tables.checkpoint()
            + " WHERE projection_name=? ORDER BY stream_id",
        rs -> new ProjectionCheckpoint(rs.getString(1), rs.getString(2), rs.getLong(3)),
        projectionName);
  }

  @Override
  public int deleteAll(Connection conn, String projectionName) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tables.checkpoint() + " WHERE projection_name=?", projectionName);
  }
}
