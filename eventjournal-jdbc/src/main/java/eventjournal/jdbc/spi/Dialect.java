package eventjournal.jdbc.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific parts of the journal stores: how
 * to insert a row unless its key exists, how duplicate keys are reported, and the
 * schema script. Register custom dialects via
 * {@code META-INF/services/eventjournal.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL, PostgreSQL, H2.
 *
 * @see eventjournal.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL inserting one row that does nothing, or fails with a duplicate key, when a row
   * with the same key already exists.
   *
   * <p>Callers treat both an update count of 0 and a duplicate-key error as "row exists".
   *
   * @param table      the table
   * @param columns    the comma-separated column list
   * @param keyColumns the comma-separated key columns
   */
  String insertIfAbsentSql(String table, String columns, String keyColumns);

  /**
   * Returns whether the exception reports a unique or primary key violation.
   */
  boolean isDuplicateKey(SQLException e);

  /**
   * Returns whether the exception reports that another open transaction holds the row
   * being written, for databases that fail such a write instead of blocking on it. The
   * stores treat it like a lost compare-and-set.
   */
  default boolean isWriteConflict(SQLException e) {
    return false;
  }

  /**
   * Classpath location of the schema script. Table names in the script are written as
   * {@code ${prefix}event}, {@code ${prefix}stream}, etc.
   */
  default String schemaResource() {
    return "/schema/" + name() + ".sql";
  }
}
