package eventjournal.jdbc.dialect;

import eventjournal.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * The dialects the journal stores can run on, discovered once through
 * {@link ServiceLoader} ({@code META-INF/services/eventjournal.jdbc.spi.Dialect}).
 *
 * <p>{@link eventjournal.jdbc.JdbcStores#detect} resolves the dialect from the JDBC URL
 * of the journal's DataSource; {@link #get} picks one by the name its schema script is
 * filed under.
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      Dialect previous = byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
      if (previous != null) {
        throw new IllegalStateException("Two dialects are registered as " + dialect.name() + ": "
            + previous.getClass().getName() + " and " + dialect.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  /**
   * Returns the registered dialects in discovery order.
   */
  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Resolves the dialect of the database behind a DataSource from its connection URL.
   *
   * @throws IllegalStateException if no connection can be opened
   * @throws IllegalArgumentException if no dialect handles the URL
   */
  public static Dialect detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot open a connection to detect the journal dialect", e);
    }
    return detect(url);
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or no dialect handles it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (Dialect dialect : BY_NAME.values()) {
      if (dialect.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
        + ". Journal stores support " + BY_NAME.keySet());
  }
}
