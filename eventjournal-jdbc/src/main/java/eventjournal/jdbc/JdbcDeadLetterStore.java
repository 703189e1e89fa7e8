package eventjournal.jdbc;

import eventjournal.jdbc.spi.Dialect;
import eventjournal.model.DeadLetterRecord;
import eventjournal.spi.DeadLetterStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC dead-letter store. One row per quarantined (projection, stream) pair holds the
 * bounds of the quarantined version range.
 */
public final class JdbcDeadLetterStore extends AbstractJdbcStore implements DeadLetterStore {
  private static final String COLUMNS =
      "projection_name, stream_id, failed_at_version, last_queued_version, reason, enqueued_at, updated_at";

  public JdbcDeadLetterStore(Dialect dialect) {
    this(dialect, JournalTables.withDefaultPrefix());
  }

  public JdbcDeadLetterStore(Dialect dialect, JournalTables tables) {
    super(dialect, tables);
  }

  @Override
  public DeadLetterRecord quarantine(Connection conn, String projectionName, String streamId,
      long version, String reason, Instant now) {
    boolean inserted = insertIfAbsent(conn, tables.deadLetter(), COLUMNS, "projection_name, stream_id",
        projectionName, streamId, version, version, reason, ts(now), ts(now));
    if (!inserted) {
      extend(conn, projectionName, streamId, version, now);
    }
    return find(conn, projectionName, streamId)
        .orElseThrow(() -> new JournalStoreException(
            "Dead letter entry vanished for " + projectionName + "/" + streamId, null));
  }

  @Override
  public boolean extend(Connection conn, String projectionName, String streamId, long version, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.deadLetter() + " SET last_queued_version=GREATEST(last_queued_version, ?), updated_at=?"
            + " WHERE projection_name=? AND stream_id=?",
        version, ts(now), projectionName, streamId) > 0;
  }

  @Override
  public boolean markFailed(Connection conn, String projectionName, String streamId,
      long failedAtVersion, String reason, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.deadLetter() + " SET failed_at_version=?, reason=?, updated_at=?"
            + " WHERE projection_name=? AND stream_id=? AND last_queued_version>=?",
        failedAtVersion, reason, ts(now), projectionName, streamId, failedAtVersion) > 0;
  }

  @Override
  public Optional<DeadLetterRecord> find(Connection conn, String projectionName, String streamId) {
    List<DeadLetterRecord> rows = JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tables.deadLetter() + " WHERE projection_name=? AND stream_id=?",
        JdbcDeadLetterStore::mapRecord, projectionName, streamId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<DeadLetterRecord> list(Connection conn, String projectionName) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tables.deadLetter()
            + " WHERE projection_name=? ORDER BY enqueued_at, stream_id",
        JdbcDeadLetterStore::mapRecord, projectionName);
  }

  @Override
  public List<DeadLetterRecord> listAll(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tables.deadLetter() + " ORDER BY enqueued_at, projection_name, stream_id",
        JdbcDeadLetterStore::mapRecord);
  }

  @Override
  public boolean close(Connection conn, String projectionName, String streamId, long lastQueuedVersion) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tables.deadLetter()
            + " WHERE projection_name=? AND stream_id=? AND last_queued_version<=?",
        projectionName, streamId, lastQueuedVersion) > 0;
  }

  @Override
  public int deleteAll(Connection conn, String projectionName) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tables.deadLetter() + " WHERE projection_name=?", projectionName);
  }

  private static DeadLetterRecord mapRecord(ResultSet rs) throws SQLException {
    return new DeadLetterRecord(
        rs.getString("projection_name"),
        rs.getString("stream_id"),
        rs.getLong("failed_at_version"),
        rs.getLong("last_queued_version"),
        rs.getString("reason"),
        instant(rs.getTimestamp("enqueued_at")),
        instant(rs.getTimestamp("updated_at")));
  }
}
