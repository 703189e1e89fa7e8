package eventjournal.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING}: a failed statement would abort the whole
 * PostgreSQL transaction, so duplicate keys must not surface as errors.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String insertIfAbsentSql(String table, String columns, String keyColumns) {
    return super.insertIfAbsentSql(table, columns, keyColumns) + " ON CONFLICT (" + keyColumns + ") DO NOTHING";
  }
}
