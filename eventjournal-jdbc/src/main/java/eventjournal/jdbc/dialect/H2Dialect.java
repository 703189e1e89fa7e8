package eventjournal.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect, used by the in-memory test databases.
 *
 * <p>H2 rejects an insert of a stream, checkpoint or dead-letter key that another open
 * transaction has just inserted with a concurrent-update error rather than waiting for
 * it; that error is reported as a write conflict so the append loses with a version
 * conflict like on the other databases.
 */
public final class H2Dialect extends AbstractDialect {
  private static final int CONCURRENT_UPDATE = 90131;

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean isWriteConflict(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getErrorCode() == CONCURRENT_UPDATE) {
        return true;
      }
    }
    return false;
  }
}
