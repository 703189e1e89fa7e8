package eventjournal;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class JournalConfigTest {

  @Test
  void defaults() {
    JournalConfig config = new JournalConfig();

    assertEquals(1000L, config.getSnapshotEveryEvents());
    assertEquals(600_000L, config.getSnapshotMaxAgeMs());
    assertEquals(3, config.getCommandMaxAttempts());
    assertEquals(3, config.getStorageMaxAttempts());
    assertEquals(500, config.getReadPageSize());
    assertTrue(config.isTailerEnabled());
    assertEquals(30_000L, config.getTailerGapTimeoutMs());
    assertFalse(config.isRedriveEnabled());
    assertFalse(config.isSnapshotCompactionEnabled());
    assertEquals(64, config.getLockStripes());
  }

  @Test
  void readsPrefixedProperties() {
    Properties properties = new Properties();
    properties.setProperty("eventjournal.snapshot.every-events", "50");
    properties.setProperty("eventjournal.snapshot.compaction.enabled", "TRUE");
    properties.setProperty("eventjournal.command.serialize-locally", "true");
    properties.setProperty("eventjournal.tailer.skip-recent-ms", " 250 ");
    properties.setProperty("eventjournal.tailer.gap-timeout-ms", "5000");
    properties.setProperty("eventjournal.redrive.enabled", "true");
    properties.setProperty("eventjournal.redrive.max-attempts", "9");
    properties.setProperty("eventjournal.lock-stripes", "16");
    properties.setProperty("snapshot.every-events", "7");

    JournalConfig config = JournalConfig.fromProperties(properties);

    assertEquals(50L, config.getSnapshotEveryEvents());
    assertTrue(config.isSnapshotCompactionEnabled());
    assertTrue(config.isCommandSerializeLocally());
    assertEquals(250L, config.getTailerSkipRecentMs());
    assertEquals(5000L, config.getTailerGapTimeoutMs());
    assertTrue(config.isRedriveEnabled());
    assertEquals(9, config.getRedriveMaxAttempts());
    assertEquals(16, config.getLockStripes());
    assertEquals(1000L, config.getTailerIntervalMs());
  }

  @Test
  void rejectsUnparsableValues() {
    Properties properties = new Properties();
    properties.setProperty("eventjournal.tailer.batch-size", "lots");

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JournalConfig.fromProperties(properties));
    assertTrue(e.getMessage().contains("eventjournal.tailer.batch-size"));

    Properties flags = new Properties();
    flags.setProperty("eventjournal.redrive.enabled", "yes");
    assertThrows(IllegalArgumentException.class, () -> JournalConfig.fromProperties(flags));
  }

  @Test
  void settersChain() {
    JournalConfig config = new JournalConfig()
        .setReadPageSize(10)
        .setTailerEnabled(false)
        .setRedriveIntervalMs(5);

    assertEquals(10, config.getReadPageSize());
    assertFalse(config.isTailerEnabled());
    assertEquals(5L, config.getRedriveIntervalMs());
  }
}
