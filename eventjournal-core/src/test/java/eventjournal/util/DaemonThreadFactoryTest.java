package eventjournal.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

  @Test
  void createsNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("journal-tailer-");

    Thread first = factory.newThread(() -> {
    });
    Thread second = factory.newThread(() -> {
    });

    assertTrue(first.isDaemon());
    assertEquals("journal-tailer-1", first.getName());
    assertEquals("journal-tailer-2", second.getName());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
