package eventjournal.jdbc;

import eventjournal.JournalException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC journal stores.
 */
public final class JournalStoreException extends JournalException {

  public JournalStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the underlying {@link SQLException}, or {@code null} if the cause is not one.
   */
  public SQLException sqlException() {
    return getCause() instanceof SQLException e ? e : null;
  }
}
