package eventjournal.model;

import eventjournal.EventEnvelope;

import java.time.Instant;
import java.util.Objects;

/**
 * An event together with its storage-assigned journal position and commit time.
 *
 * <p>Positions increase with insertion order and let a tailer resume where it left
 * off. They are not an ordering contract across streams: two concurrent appends may
 * become visible out of position order.
 *
 * @param position   the journal position
 * @param event      the committed event
 * @param recordedAt when the storage recorded the event
 */
public record JournalRecord(long position, EventEnvelope event, Instant recordedAt) {

  public JournalRecord {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(recordedAt, "recordedAt");
  }
}
