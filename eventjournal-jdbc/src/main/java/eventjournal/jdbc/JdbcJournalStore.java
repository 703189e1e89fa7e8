package eventjournal.jdbc;

import eventjournal.EventEnvelope;
import eventjournal.VersionConflictException;
import eventjournal.jdbc.spi.Dialect;
import eventjournal.model.JournalRecord;
import eventjournal.spi.JournalStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC journal store.
 *
 * <p>Each stream has one row in the stream table holding its current version. An append
 * moves that row from the expected version to the new one with a conditional update
 * (or inserts it for a new stream) and then inserts the events, all on the caller's
 * transaction. Concurrent appends to the same stream serialize on the stream row; the
 * loser sees zero affected rows and gets a {@link VersionConflictException}.
 *
 * <p>The unique key on {@code (stream_id, version)} in the event table backs this up.
 */
public final class JdbcJournalStore extends AbstractJdbcStore implements JournalStore {
  private static final String EVENT_COLUMNS =
      "event_id, stream_id, version, event_type, payload, correlation_id, causation_id, occurred_at, recorded_at, erased";
  private static final byte[] EMPTY = new byte[0];

  public JdbcJournalStore(Dialect dialect) {
    this(dialect, JournalTables.withDefaultPrefix());
  }

  public JdbcJournalStore(Dialect dialect, JournalTables tables) {
    super(dialect, tables);
  }

  @Override
  public void append(Connection conn, String streamId, long expectedVersion, List<EventEnvelope> events) {
    if (events.isEmpty()) {
      return;
    }
    long newVersion = expectedVersion + events.size();
    Timestamp now = ts(Instant.now());

    boolean moved;
    if (expectedVersion == 0) {
      moved = insertIfAbsent(conn, tables.stream(), "stream_id, version, updated_at", "stream_id",
          streamId, newVersion, now);
    } else {
      moved = compareAndSetVersion(conn, streamId, expectedVersion, newVersion, now);
    }
    if (!moved) {
      throw new VersionConflictException(streamId, expectedVersion, currentVersion(conn, streamId));
    }

    List<Object[]> rows = new ArrayList<>(events.size());
    for (EventEnvelope event : events) {
      rows.add(new Object[] {
          event.eventId(),
          streamId,
          event.version(),
          event.type(),
          event.payload(),
          event.correlationId(),
          event.causationId(),
          ts(event.occurredAt()),
          now,
          false
      });
    }
    JdbcTemplate.batchUpdate(conn,
        "INSERT INTO " + tables.event() + " (" + EVENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)",
        rows);
  }

  private boolean compareAndSetVersion(Connection conn, String streamId, long expectedVersion, long newVersion,
      Timestamp now) {
    try {
      return JdbcTemplate.update(conn,
          "UPDATE " + tables.stream() + " SET version=?, updated_at=? WHERE stream_id=? AND version=?",
          newVersion, now, streamId, expectedVersion) > 0;
    } catch (JournalStoreException e) {
      if (e.sqlException() != null && dialect.isWriteConflict(e.sqlException())) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public List<EventEnvelope> read(Connection conn, String streamId, long fromVersion, long toVersion, int limit) {
    if (limit <= 0 || toVersion < fromVersion) {
      return List.of();
    }
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + tables.event()
        + " WHERE stream_id=? AND version>=? AND version<=? ORDER BY version LIMIT ?";
    return JdbcTemplate.query(conn, sql, JdbcJournalStore::mapEvent, streamId, fromVersion, toVersion, limit);
  }

  @Override
  public long currentVersion(Connection conn, String streamId) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT version FROM " + tables.stream() + " WHERE stream_id=?", 0L, streamId);
  }

  @Override
  public List<String> streamIds(Connection conn, String afterStreamId, int limit) {
    if (afterStreamId == null) {
      return JdbcTemplate.query(conn,
          "SELECT stream_id FROM " + tables.stream() + " ORDER BY stream_id LIMIT ?",
          rs -> rs.getString(1), limit);
    }
    return JdbcTemplate.query(conn,
        "SELECT stream_id FROM " + tables.stream() + " WHERE stream_id>? ORDER BY stream_id LIMIT ?",
        rs -> rs.getString(1), afterStreamId, limit);
  }

  @Override
  public List<JournalRecord> readAll(Connection conn, long afterPosition, int limit) {
    String sql = "SELECT seq, " + EVENT_COLUMNS + " FROM " + tables.event()
        + " WHERE seq>? ORDER BY seq LIMIT ?";
    return JdbcTemplate.query(conn, sql,
        rs -> new JournalRecord(rs.getLong("seq"), mapEvent(rs), instant(rs.getTimestamp("recorded_at"))),
        afterPosition, limit);
  }

  @Override
  public long headPosition(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COALESCE(MAX(seq), 0) FROM " + tables.event(), 0L);
  }

  @Override
  public int erasePayloads(Connection conn, String streamId) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.event() + " SET payload=?, erased=? WHERE stream_id=? AND erased=?",
        EMPTY, true, streamId, false);
  }

  private static EventEnvelope mapEvent(ResultSet rs) throws SQLException {
    byte[] payload = rs.getBytes("payload");
    return EventEnvelope.builder(rs.getString("event_type"))
        .eventId(rs.getString("event_id"))
        .streamId(rs.getString("stream_id"))
        .version(rs.getLong("version"))
        .payload(payload == null ? EMPTY : payload)
        .correlationId(rs.getString("correlation_id"))
        .causationId(rs.getString("causation_id"))
        .occurredAt(instant(rs.getTimestamp("occurred_at")))
        .payloadErased(rs.getBoolean("erased"))
        .build();
  }
}
