package eventjournal.jdbc;

import eventjournal.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;

/**
 * Shared plumbing of the JDBC stores: dialect, table names, and insert-if-absent.
 */
abstract class AbstractJdbcStore {
  protected final Dialect dialect;
  protected final JournalTables tables;

  protected AbstractJdbcStore(Dialect dialect, JournalTables tables) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  public Dialect dialect() {
    return dialect;
  }

  public JournalTables tables() {
    return tables;
  }

  /**
   * Inserts one row unless its key exists.
   *
   * @return {@code true} if the row was inserted
   */
  protected boolean insertIfAbsent(Connection conn, String table, String columns, String keyColumns,
      Object... params) {
    String sql = dialect.insertIfAbsentSql(table, columns, keyColumns);
    try {
      return JdbcTemplate.update(conn, sql, params) > 0;
    } catch (JournalStoreException e) {
      SQLException cause = e.sqlException();
      if (cause != null && (dialect.isDuplicateKey(cause) || dialect.isWriteConflict(cause))) {
        return false;
      }
      throw e;
    }
  }

  protected static Timestamp ts(Instant instant) {
    return Timestamp.from(instant);
  }

  protected static Instant instant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
