package eventjournal.jdbc.dialect;

import eventjournal.jdbc.spi.Dialect;

import java.sql.SQLException;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {
  /** SQLSTATE of unique_violation in the SQL standard. */
  protected static final String UNIQUE_VIOLATION = "23505";

  @Override
  public String insertIfAbsentSql(String table, String columns, String keyColumns) {
    return "INSERT INTO " + table + " (" + columns + ") VALUES (" + placeholders(columns) + ")";
  }

  @Override
  public boolean isDuplicateKey(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
        return true;
      }
    }
    return false;
  }

  protected static String placeholders(String columns) {
    int count = columns.split(",").length;
    return String.join(",", java.util.Collections.nCopies(count, "?"));
  }
}
