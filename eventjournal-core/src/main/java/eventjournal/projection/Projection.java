package eventjournal.projection;

import eventjournal.EventEnvelope;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A read model built by consuming events in per-stream version order.
 *
 * <p>{@link #apply} runs inside the transaction that also advances the projection's
 * checkpoint, on the connection it receives; it must not commit or roll back. Delivery
 * is at-least-once, so the update must be idempotent: write values derived from the
 * event (and rows already committed), never unguarded increments.
 *
 * <p>Throwing from {@code apply} rolls the transaction back and quarantines the stream.
 *
 * @see ProjectionHandlers
 */
@FunctionalInterface
public interface Projection {

  void apply(Connection conn, EventEnvelope event) throws SQLException;

  /**
   * Drops the read model before a rebuild. Runs in the same transaction that deletes the
   * projection's checkpoints.
   */
  default void reset(Connection conn) throws SQLException {
  }
}
