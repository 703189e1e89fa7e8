package eventjournal.projection;

import eventjournal.EventEnvelope;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Read-model update for one event type.
 */
@FunctionalInterface
public interface ProjectionHandler {

  void handle(Connection conn, EventEnvelope event) throws SQLException;
}
