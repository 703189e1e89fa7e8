package eventjournal.model;

import eventjournal.EventEnvelope;

import java.util.List;
import java.util.Objects;

/**
 * An open dead-letter entry with its queued events materialized from the journal,
 * in ascending version order starting at {@code failedAtVersion}.
 */
public record DeadLetterEntry(DeadLetterRecord record, List<EventEnvelope> queuedEvents) {

  public DeadLetterEntry {
    Objects.requireNonNull(record, "record");
    queuedEvents = List.copyOf(queuedEvents);
  }

  public String streamId() {
    return record.streamId();
  }

  public long failedAtVersion() {
    return record.failedAtVersion();
  }

  public String reason() {
    return record.reason();
  }
}
