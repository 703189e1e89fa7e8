package eventjournal;

import java.util.Objects;
import java.util.Properties;

/**
 * Tunables of a {@link Journal}, with defaults for every value.
 *
 * <p>Can be populated fluently or from {@link Properties} with
 * {@link #fromProperties(Properties)}, using {@code eventjournal.*} keys:
 * <pre>
 * eventjournal.snapshot.every-events=1000
 * eventjournal.snapshot.max-age-ms=600000
 * eventjournal.tailer.interval-ms=1000
 * eventjournal.tailer.gap-timeout-ms=30000
 * eventjournal.redrive.enabled=true
 * </pre>
 */
public final class JournalConfig {
  static final String PREFIX = "eventjournal.";

  private long snapshotEveryEvents = 1000L;
  private long snapshotMaxAgeMs = 600_000L;
  private boolean snapshotCompactionEnabled = false;
  private long snapshotCompactionIntervalMs = 60_000L;
  private int snapshotCompactionBatchSize = 100;

  private int commandMaxAttempts = 3;
  private boolean commandSerializeLocally = false;

  private int storageMaxAttempts = 3;
  private long storageRetryBaseDelayMs = 50L;
  private long storageRetryMaxDelayMs = 2_000L;
  private int readPageSize = 500;

  private boolean tailerEnabled = true;
  private long tailerIntervalMs = 1000L;
  private int tailerBatchSize = 200;
  private long tailerSkipRecentMs = 0L;
  private long tailerGapTimeoutMs = 30_000L;

  private boolean redriveEnabled = false;
  private long redriveIntervalMs = 30_000L;
  private int redriveMaxAttempts = 5;
  private long redriveBaseDelayMs = 1_000L;
  private long redriveMaxDelayMs = 300_000L;

  private int lockStripes = 64;

  /**
   * Reads a configuration from properties. Missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static JournalConfig fromProperties(Properties properties) {
    Objects.requireNonNull(properties, "properties");
    PropertyReader reader = new PropertyReader(properties);
    JournalConfig config = new JournalConfig();
    config.snapshotEveryEvents = reader.getLong("snapshot.every-events", config.snapshotEveryEvents);
    config.snapshotMaxAgeMs = reader.getLong("snapshot.max-age-ms", config.snapshotMaxAgeMs);
    config.snapshotCompactionEnabled = reader.getBoolean("snapshot.compaction.enabled", config.snapshotCompactionEnabled);
    config.snapshotCompactionIntervalMs = reader.getLong("snapshot.compaction.interval-ms", config.snapshotCompactionIntervalMs);
    config.snapshotCompactionBatchSize = reader.getInt("snapshot.compaction.batch-size", config.snapshotCompactionBatchSize);
    config.commandMaxAttempts = reader.getInt("command.max-attempts", config.commandMaxAttempts);
    config.commandSerializeLocally = reader.getBoolean("command.serialize-locally", config.commandSerializeLocally);
    config.storageMaxAttempts = reader.getInt("storage.max-attempts", config.storageMaxAttempts);
    config.storageRetryBaseDelayMs = reader.getLong("storage.retry.base-delay-ms", config.storageRetryBaseDelayMs);
    config.storageRetryMaxDelayMs = reader.getLong("storage.retry.max-delay-ms", config.storageRetryMaxDelayMs);
    config.readPageSize = reader.getInt("read.page-size", config.readPageSize);
    config.tailerEnabled = reader.getBoolean("tailer.enabled", config.tailerEnabled);
    config.tailerIntervalMs = reader.getLong("tailer.interval-ms", config.tailerIntervalMs);
    config.tailerBatchSize = reader.getInt("tailer.batch-size", config.tailerBatchSize);
    config.tailerSkipRecentMs = reader.getLong("tailer.skip-recent-ms", config.tailerSkipRecentMs);
    config.tailerGapTimeoutMs = reader.getLong("tailer.gap-timeout-ms", config.tailerGapTimeoutMs);
    config.redriveEnabled = reader.getBoolean("redrive.enabled", config.redriveEnabled);
    config.redriveIntervalMs = reader.getLong("redrive.interval-ms", config.redriveIntervalMs);
    config.redriveMaxAttempts = reader.getInt("redrive.max-attempts", config.redriveMaxAttempts);
    config.redriveBaseDelayMs = reader.getLong("redrive.base-delay-ms", config.redriveBaseDelayMs);
    config.redriveMaxDelayMs = reader.getLong("redrive.max-delay-ms", config.redriveMaxDelayMs);
    config.lockStripes = reader.getInt("lock-stripes", config.lockStripes);
    return config;
  }

  public long getSnapshotEveryEvents() {
    return snapshotEveryEvents;
  }

  public JournalConfig setSnapshotEveryEvents(long snapshotEveryEvents) {
    this.snapshotEveryEvents = snapshotEveryEvents;
    return this;
  }

  public long getSnapshotMaxAgeMs() {
    return snapshotMaxAgeMs;
  }

  public JournalConfig setSnapshotMaxAgeMs(long snapshotMaxAgeMs) {
    this.snapshotMaxAgeMs = snapshotMaxAgeMs;
    return this;
  }

  public boolean isSnapshotCompactionEnabled() {
    return snapshotCompactionEnabled;
  }

  public JournalConfig setSnapshotCompactionEnabled(boolean snapshotCompactionEnabled) {
    this.snapshotCompactionEnabled = snapshotCompactionEnabled;
    return this;
  }

  public long getSnapshotCompactionIntervalMs() {
    return snapshotCompactionIntervalMs;
  }

  public JournalConfig setSnapshotCompactionIntervalMs(long snapshotCompactionIntervalMs) {
    this.snapshotCompactionIntervalMs = snapshotCompactionIntervalMs;
    return this;
  }

  public int getSnapshotCompactionBatchSize() {
    return snapshotCompactionBatchSize;
  }

  public JournalConfig setSnapshotCompactionBatchSize(int snapshotCompactionBatchSize) {
    this.snapshotCompactionBatchSize = snapshotCompactionBatchSize;
    return this;
  }

  public int getCommandMaxAttempts() {
    return commandMaxAttempts;
  }

  public JournalConfig setCommandMaxAttempts(int commandMaxAttempts) {
    this.commandMaxAttempts = commandMaxAttempts;
    return this;
  }

  public boolean isCommandSerializeLocally() {
    return commandSerializeLocally;
  }

  public JournalConfig setCommandSerializeLocally(boolean commandSerializeLocally) {
    this.commandSerializeLocally = commandSerializeLocally;
    return this;
  }

  public int getStorageMaxAttempts() {
    return storageMaxAttempts;
  }

  public JournalConfig setStorageMaxAttempts(int storageMaxAttempts) {
    this.storageMaxAttempts = storageMaxAttempts;
    return this;
  }

  public long getStorageRetryBaseDelayMs() {
    return storageRetryBaseDelayMs;
  }

  public JournalConfig setStorageRetryBaseDelayMs(long storageRetryBaseDelayMs) {
    this.storageRetryBaseDelayMs = storageRetryBaseDelayMs;
    return this;
  }

  public long getStorageRetryMaxDelayMs() {
    return storageRetryMaxDelayMs;
  }

  public JournalConfig setStorageRetryMaxDelayMs(long storageRetryMaxDelayMs) {
    this.storageRetryMaxDelayMs = storageRetryMaxDelayMs;
    return this;
  }

  public int getReadPageSize() {
    return readPageSize;
  }

  public JournalConfig setReadPageSize(int readPageSize) {
    this.readPageSize = readPageSize;
    return this;
  }

  public boolean isTailerEnabled() {
    return tailerEnabled;
  }

  public JournalConfig setTailerEnabled(boolean tailerEnabled) {
    this.tailerEnabled = tailerEnabled;
    return this;
  }

  public long getTailerIntervalMs() {
    return tailerIntervalMs;
  }

  public JournalConfig setTailerIntervalMs(long tailerIntervalMs) {
    this.tailerIntervalMs = tailerIntervalMs;
    return this;
  }

  public int getTailerBatchSize() {
    return tailerBatchSize;
  }

  public JournalConfig setTailerBatchSize(int tailerBatchSize) {
    this.tailerBatchSize = tailerBatchSize;
    return this;
  }

  public long getTailerSkipRecentMs() {
    return tailerSkipRecentMs;
  }

  public JournalConfig setTailerSkipRecentMs(long tailerSkipRecentMs) {
    this.tailerSkipRecentMs = tailerSkipRecentMs;
    return this;
  }

  public long getTailerGapTimeoutMs() {
    return tailerGapTimeoutMs;
  }

  public JournalConfig setTailerGapTimeoutMs(long tailerGapTimeoutMs) {
    this.tailerGapTimeoutMs = tailerGapTimeoutMs;
    return this;
  }

  public boolean isRedriveEnabled() {
    return redriveEnabled;
  }

  public JournalConfig setRedriveEnabled(boolean redriveEnabled) {
    this.redriveEnabled = redriveEnabled;
    return this;
  }

  public long getRedriveIntervalMs() {
    return redriveIntervalMs;
  }

  public JournalConfig setRedriveIntervalMs(long redriveIntervalMs) {
    this.redriveIntervalMs = redriveIntervalMs;
    return this;
  }

  public int getRedriveMaxAttempts() {
    return redriveMaxAttempts;
  }

  public JournalConfig setRedriveMaxAttempts(int redriveMaxAttempts) {
    this.redriveMaxAttempts = redriveMaxAttempts;
    return this;
  }

  public long getRedriveBaseDelayMs() {
    return redriveBaseDelayMs;
  }

  public JournalConfig setRedriveBaseDelayMs(long redriveBaseDelayMs) {
    this.redriveBaseDelayMs = redriveBaseDelayMs;
    return this;
  }

  public long getRedriveMaxDelayMs() {
    return redriveMaxDelayMs;
  }

  public JournalConfig setRedriveMaxDelayMs(long redriveMaxDelayMs) {
    this.redriveMaxDelayMs = redriveMaxDelayMs;
    return this;
  }

  public int getLockStripes() {
    return lockStripes;
  }

  public JournalConfig setLockStripes(int lockStripes) {
    this.lockStripes = lockStripes;
    return this;
  }

  private static final class PropertyReader {
    private final Properties properties;

    PropertyReader(Properties properties) {
      this.properties = properties;
    }

    long getLong(String key, long defaultValue) {
      String value = value(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
      }
    }

    int getInt(String key, int defaultValue) {
      String value = value(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
      }
    }

    boolean getBoolean(String key, boolean defaultValue) {
      String value = value(key);
      if (value == null) {
        return defaultValue;
      }
      if (value.equalsIgnoreCase("true")) {
        return true;
      }
      if (value.equalsIgnoreCase("false")) {
        return false;
      }
      throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value);
    }

    private String value(String key) {
      String value = properties.getProperty(PREFIX + key);
      return value == null ? null : value.trim();
    }
  }
}
