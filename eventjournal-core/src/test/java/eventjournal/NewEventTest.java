package eventjournal;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NewEventTest {

  @Test
  void ofJsonFillsDefaultMetadata() {
    NewEvent event = NewEvent.ofJson("Deposited", "{\"amount\":10}");

    assertEquals(36, event.eventId().length()); // UUID text form
    assertEquals("Deposited", event.type());
    assertEquals(event.eventId(), event.correlationId());
    assertEquals(event.eventId(), event.causationId());
    assertNotNull(event.occurredAt());
    assertArrayEquals("{\"amount\":10}".getBytes(StandardCharsets.UTF_8), event.payload());
  }

  @Test
  void eventIdsAreUniqueAndTimeOrdered() {
    NewEvent first = NewEvent.ofJson("A", "{}");
    NewEvent second = NewEvent.ofJson("A", "{}");

    assertNotEquals(first.eventId(), second.eventId());
    assertTrue(first.eventId().compareTo(second.eventId()) < 0);
  }

  @Test
  void causedByInheritsCorrelation() {
    EventEnvelope cause = NewEvent.builder("OrderPlaced")
        .correlationId("req-1")
        .payloadJson("{}")
        .build()
        .toEnvelope("order-1", 1);

    NewEvent effect = NewEvent.builder(StringEventType.of("PaymentRequested"))
        .causedBy(cause)
        .payloadJson("{}")
        .build();

    assertEquals("req-1", effect.correlationId());
    assertEquals(cause.eventId(), effect.causationId());
  }

  @Test
  void toEnvelopeBindsStreamPosition() {
    Instant occurredAt = Instant.parse("2026-02-02T10:00:00Z");
    NewEvent event = NewEvent.builder("Deposited")
        .eventId("e-1")
        .occurredAt(occurredAt)
        .payloadJson("{}")
        .build();

    EventEnvelope envelope = event.toEnvelope("acct-1", 7);

    assertEquals("e-1", envelope.eventId());
    assertEquals("acct-1", envelope.streamId());
    assertEquals(7, envelope.version());
    assertEquals(occurredAt, envelope.occurredAt());
    assertFalse(envelope.payloadErased());
  }

  @Test
  void payloadIsCopied() {
    byte[] payload = {1, 2, 3};
    NewEvent event = NewEvent.builder("Raw").payload(payload).build();
    payload[0] = 9;

    assertEquals(1, event.payload()[0]);
    event.payload()[1] = 9;
    assertEquals(2, event.payload()[1]);
  }

  @Test
  void rejectsInvalidEvents() {
    assertThrows(IllegalArgumentException.class, () -> NewEvent.builder("").payloadJson("{}").build());
    assertThrows(IllegalArgumentException.class, () -> NewEvent.builder("A").build());
    assertThrows(NullPointerException.class, () -> NewEvent.builder((String) null).payloadJson("{}").build());
    assertThrows(IllegalArgumentException.class, () -> NewEvent.builder("A")
        .payload(new byte[EventEnvelope.MAX_PAYLOAD_BYTES + 1]).build());
    assertThrows(IllegalArgumentException.class, () -> StringEventType.of(""));
  }
}
