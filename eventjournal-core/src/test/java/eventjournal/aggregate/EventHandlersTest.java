package eventjournal.aggregate;

import eventjournal.support.Accounts;
import eventjournal.support.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventHandlersTest {

  @Test
  void foldsKnownTypes() {
    EventHandlers<Long> handlers = Accounts.handlers();

    long balance = handlers.apply(100L, Accounts.withdrawn(30).toEnvelope("acct-1", 2));

    assertEquals(70L, balance);
    assertEquals(Set.of(Accounts.DEPOSITED, Accounts.WITHDRAWN), handlers.types());
  }

  @Test
  void unknownTypeNamesStreamAndVersion() {
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> Accounts.handlers().apply(0L, TestEvents.envelope("acct-1", 3)));

    assertTrue(e.getMessage().contains("Ticked"));
    assertTrue(e.getMessage().contains("acct-1"));
  }

  @Test
  void builderValidation() {
    assertThrows(IllegalStateException.class, () -> EventHandlers.<Long>builder().build());
    assertThrows(IllegalArgumentException.class, () -> EventHandlers.<Long>builder()
        .on("A", (s, e) -> s)
        .on("A", (s, e) -> s));
  }
}
