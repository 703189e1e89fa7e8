package eventjournal.spi;

import eventjournal.EventEnvelope;
import eventjournal.VersionConflictException;
import eventjournal.model.JournalRecord;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for the append-only event journal.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code eventjournal-jdbc} module.
 */
public interface JournalStore {

  /**
   * Appends a contiguous batch of events to a stream, guarded by the expected version.
   *
   * <p>The events carry versions {@code expectedVersion+1 .. expectedVersion+n}. The
   * version check and every insert must happen on {@code conn} so that they commit or
   * roll back together; the caller commits.
   *
   * @param conn            the JDBC connection (auto-commit disabled)
   * @param streamId        the target stream
   * @param expectedVersion the version the caller last observed
   * @param events          events already bound to their versions
   * @throws VersionConflictException if the stream is not at {@code expectedVersion}
   */
  void append(Connection conn, String streamId, long expectedVersion, List<EventEnvelope> events);

  /**
   * Reads events of a stream with {@code fromVersion <= version <= toVersion}, ascending.
   *
   * @param limit maximum number of events to return
   */
  List<EventEnvelope> read(Connection conn, String streamId, long fromVersion, long toVersion, int limit);

  /**
   * Returns the version of the last committed event of the stream, or 0 if it has none.
   */
  long currentVersion(Connection conn, String streamId);

  /**
   * Lists stream ids in ascending order, strictly after {@code afterStreamId}
   * ({@code null} to start from the beginning).
   */
  List<String> streamIds(Connection conn, String afterStreamId, int limit);

  /**
   * Reads events across all streams with a journal position greater than
   * {@code afterPosition}, ascending by position.
   */
  List<JournalRecord> readAll(Connection conn, long afterPosition, int limit);

  /**
   * Returns the highest assigned journal position, or 0 for an empty journal.
   */
  long headPosition(Connection conn);

  /**
   * Replaces the payload of every event in the stream with an empty payload and
   * marks it erased. Ordering metadata is left untouched.
   *
   * @return the number of events erased
   */
  int erasePayloads(Connection conn, String streamId);
}
