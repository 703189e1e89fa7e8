package eventjournal.jdbc;

import java.util.Objects;

/**
 * Table names of the journal schema, derived from a validated prefix.
 */
public final class JournalTables {
  public static final String DEFAULT_PREFIX = "journal_";
  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String prefix;

  private JournalTables(String prefix) {
    this.prefix = prefix;
  }

  public static JournalTables withDefaultPrefix() {
    return new JournalTables(DEFAULT_PREFIX);
  }

  /**
   * @throws IllegalArgumentException if the prefix is not a plain SQL identifier
   */
  public static JournalTables withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return new JournalTables(prefix);
  }

  public String prefix() {
    return prefix;
  }

  public String event() {
    return prefix + "event";
  }

  public String stream() {
    return prefix + "stream";
  }

  public String snapshot() {
    return prefix + "snapshot";
  }

  public String checkpoint() {
    return prefix + "checkpoint";
  }

  public String deadLetter() {
    return prefix + "dead_letter";
  }

  @Override
  public String toString() {
    return "JournalTables{prefix=" + prefix + '}';
  }
}
