package eventjournal.spi;

import eventjournal.model.ProjectionCheckpoint;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for per-stream projection checkpoints.
 *
 * <p>{@link #advance} is called on the same connection and transaction as the read
 * model update it records.
 */
public interface CheckpointStore {

  /**
   * Returns the last applied version of the stream for the projection, or 0.
   */
  long lastApplied(Connection conn, String projectionName, String streamId);

  /**
   * Moves the checkpoint from {@code expectedVersion} to {@code newVersion}.
   *
   * <p>This is a compare-and-set: when the stored checkpoint is not
   * {@code expectedVersion} (another worker already advanced it), nothing is written
   * and {@code false} is returned. An {@code expectedVersion} of 0 means no checkpoint
   * row exists yet.
   *
   * @return {@code true} if the checkpoint was advanced
   */
  boolean advance(Connection conn, String projectionName, String streamId, long expectedVersion, long newVersion);

  List<ProjectionCheckpoint> list(Connection conn, String projectionName);

  /**
   * Deletes every checkpoint of the projection.
   *
   * @return the number of rows deleted
   */
  int deleteAll(Connection conn, String projectionName);
}
