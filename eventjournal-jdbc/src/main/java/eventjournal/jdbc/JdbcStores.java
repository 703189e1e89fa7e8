package eventjournal.jdbc;

import eventjournal.Journal;
import eventjournal.jdbc.dialect.Dialects;
import eventjournal.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The four JDBC stores of a journal, sharing one dialect and one table prefix.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcStores stores = JdbcStores.detect(dataSource);
 * stores.createSchema(dataSource);
 *
 * Journal journal = stores.configure(Journal.builder())
 *     .connectionProvider(dataSource::getConnection)
 *     .build();
 * }</pre>
 */
public final class JdbcStores {
  private static final Logger logger = Logger.getLogger(JdbcStores.class.getName());

  private final Dialect dialect;
  private final JournalTables tables;
  private final JdbcJournalStore journalStore;
  private final JdbcSnapshotStore snapshotStore;
  private final JdbcCheckpointStore checkpointStore;
  private final JdbcDeadLetterStore deadLetterStore;

  private JdbcStores(Dialect dialect, JournalTables tables) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.journalStore = new JdbcJournalStore(dialect, tables);
    this.snapshotStore = new JdbcSnapshotStore(dialect, tables);
    this.checkpointStore = new JdbcCheckpointStore(dialect, tables);
    this.deadLetterStore = new JdbcDeadLetterStore(dialect, tables);
  }

  public static JdbcStores create(Dialect dialect) {
    return new JdbcStores(dialect, JournalTables.withDefaultPrefix());
  }

  public static JdbcStores create(Dialect dialect, JournalTables tables) {
    return new JdbcStores(dialect, tables);
  }

  /**
   * Creates stores for the dialect detected from the data source's JDBC URL.
   */
  public static JdbcStores detect(DataSource dataSource) {
    return new JdbcStores(Dialects.detect(dataSource), JournalTables.withDefaultPrefix());
  }

  public static JdbcStores detect(DataSource dataSource, JournalTables tables) {
    return new JdbcStores(Dialects.detect(dataSource), tables);
  }

  /**
   * Registers the four stores on a journal builder.
   */
  public Journal.Builder configure(Journal.Builder builder) {
    return builder.stores(journalStore, snapshotStore, checkpointStore, deadLetterStore);
  }

  /**
   * Creates the journal tables if they do not exist, using the dialect's schema script.
   */
  public void createSchema(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      createSchema(conn);
    } catch (SQLException e) {
      throw new JournalStoreException("Failed to obtain connection for schema creation", e);
    }
  }

  public void createSchema(Connection conn) {
    List<String> statements = schemaStatements();
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
      if (!conn.getAutoCommit()) {
        conn.commit();
      }
    } catch (SQLException e) {
      throw new JournalStoreException("Failed to create journal schema", e);
    }
    logger.fine(() -> "Created journal schema for dialect " + dialect.name() + " with prefix " + tables.prefix());
  }

  /**
   * Returns the dialect's schema script split into statements, with table names resolved.
   */
  public List<String> schemaStatements() {
    String script = loadResource(dialect.schemaResource()).replace("${prefix}", tables.prefix());
    List<String> statements = new ArrayList<>();
    for (String part : script.split(";")) {
      String sql = stripComments(part).trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }

  private static String stripComments(String sql) {
    StringBuilder out = new StringBuilder();
    for (String line : sql.split("\n")) {
      if (!line.trim().startsWith("--")) {
        out.append(line).append('\n');
      }
    }
    return out.toString();
  }

  private static String loadResource(String path) {
    try (InputStream in = JdbcStores.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read schema resource: " + path, e);
    }
  }

  public Dialect dialect() {
    return dialect;
  }

  public JournalTables tables() {
    return tables;
  }

  public JdbcJournalStore journalStore() {
    return journalStore;
  }

  public JdbcSnapshotStore snapshotStore() {
    return snapshotStore;
  }

  public JdbcCheckpointStore checkpointStore() {
    return checkpointStore;
  }

  public JdbcDeadLetterStore deadLetterStore() {
    return deadLetterStore;
  }
}
