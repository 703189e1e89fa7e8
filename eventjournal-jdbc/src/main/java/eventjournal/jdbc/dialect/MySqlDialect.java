package eventjournal.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL dialect.
 */
public final class MySqlDialect extends AbstractDialect {
  private static final int ER_DUP_ENTRY = 1062;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:");
  }

  @Override
  public String insertIfAbsentSql(String table, String columns, String keyColumns) {
    return "INSERT IGNORE INTO " + table + " (" + columns + ") VALUES (" + placeholders(columns) + ")";
  }

  @Override
  public boolean isDuplicateKey(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY || super.isDuplicateKey(e);
  }
}
