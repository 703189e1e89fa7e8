package eventjournal.spi;

import eventjournal.model.DeadLetterRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for sequence-aware dead-letter entries.
 *
 * <p>At most one open entry exists per projection and stream. An entry only records
 * the bounds of the quarantined journal range; the queued events are read back from
 * the journal.
 */
public interface DeadLetterStore {

  /**
   * Opens an entry at {@code version}, or extends the open entry so that
   * {@code lastQueuedVersion >= version}.
   *
   * @return the entry as stored after the call
   */
  DeadLetterRecord quarantine(Connection conn, String projectionName, String streamId,
      long version, String reason, Instant now);

  /**
   * Extends the open entry to cover {@code version}. Does nothing when no entry is open.
   *
   * @return {@code true} if an open entry was extended (or already covered the version)
   */
  boolean extend(Connection conn, String projectionName, String streamId, long version, Instant now);

  /**
   * Records a new failure point inside the open entry.
   *
   * @return {@code true} if an open entry was updated
   */
  boolean markFailed(Connection conn, String projectionName, String streamId,
      long failedAtVersion, String reason, Instant now);

  Optional<DeadLetterRecord> find(Connection conn, String projectionName, String streamId);

  List<DeadLetterRecord> list(Connection conn, String projectionName);

  /**
   * Lists open entries of every projection, oldest first.
   */
  List<DeadLetterRecord> listAll(Connection conn);

  /**
   * Closes the entry, provided nothing was queued past {@code lastQueuedVersion}.
   *
   * @return {@code true} if the entry was removed
   */
  boolean close(Connection conn, String projectionName, String streamId, long lastQueuedVersion);

  int deleteAll(Connection conn, String projectionName);
}
