package eventjournal.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for journal operations that own their transaction
 * (appends, projection applies, dead-letter writes).
 *
 * <p>Callers are responsible for closing the returned connection. A
 * {@code javax.sql.DataSource} adapts with {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
