package eventjournal.journal;

import eventjournal.EventEnvelope;
import eventjournal.NewEvent;
import eventjournal.StorageFailureException;
import eventjournal.VersionConflictException;
import eventjournal.model.JournalRecord;
import eventjournal.support.CountingMetrics;
import eventjournal.support.InMemoryJournalStore;
import eventjournal.support.TestConnections;
import eventjournal.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventJournalTest {

  private InMemoryJournalStore store;
  private CountingMetrics metrics;
  private EventJournal journal;

  @BeforeEach
  void setUp() {
    store = new InMemoryJournalStore();
    metrics = new CountingMetrics();
    journal = EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .store(store)
        .retryPolicy(attempts -> 0L)
        .pageSize(2)
        .metrics(metrics)
        .build();
  }

  @Test
  void appendAssignsContiguousVersions() {
    assertEquals(2, journal.append("acct-1", 0, TestEvents.events(2)));
    assertEquals(5, journal.append("acct-1", 2, TestEvents.events(3)));

    List<Long> versions = new ArrayList<>();
    for (EventEnvelope event : journal.read("acct-1", 1)) {
      versions.add(event.version());
      assertEquals("acct-1", event.streamId());
    }
    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), versions);
    assertEquals(5, journal.currentVersion("acct-1"));
    assertEquals(5, metrics.count("appended"));
  }

  @Test
  void staleExpectedVersionIsRejectedWithoutRetry() {
    journal.append("acct-1", 0, TestEvents.events(3));

    VersionConflictException e = assertThrows(VersionConflictException.class,
        () -> journal.append("acct-1", 1, TestEvents.events(1)));

    assertEquals("acct-1", e.streamId());
    assertEquals(1, e.expectedVersion());
    assertEquals(3, e.actualVersion());
    assertEquals(2, store.appendCalls());
    assertEquals(1, metrics.count("conflict"));
    assertEquals(3, journal.currentVersion("acct-1"));
  }

  @Test
  void appendToNewStreamWithNonZeroExpectedVersionConflicts() {
    VersionConflictException e = assertThrows(VersionConflictException.class,
        () -> journal.append("acct-new", 4, TestEvents.events(1)));
    assertEquals(0, e.actualVersion());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> journal.append("acct-1", 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> journal.append("acct-1", -1, TestEvents.events(1)));
    assertThrows(IllegalArgumentException.class, () -> journal.append("", 0, TestEvents.events(1)));
    assertThrows(NullPointerException.class, () -> journal.append(null, 0, TestEvents.events(1)));
  }

  @Test
  void transientStorageFailuresAreRetried() {
    store.failNext(2);

    assertEquals(1, journal.append("acct-1", 0, TestEvents.events(1)));
    assertEquals(2, metrics.count("storageRetry"));
  }

  @Test
  void storageFailureAfterRetryBudget() {
    store.failNext(10);

    StorageFailureException e = assertThrows(StorageFailureException.class,
        () -> journal.append("acct-1", 0, TestEvents.events(1)));

    assertEquals(EventJournal.DEFAULT_MAX_STORAGE_ATTEMPTS, e.attempts());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void readPagesThroughLongStreams() {
    journal.append("acct-1", 0, TestEvents.events(7));

    EventStream stream = journal.read("acct-1", 3);

    assertEquals(3, stream.fromVersion());
    assertEquals(7, stream.toVersion());
    List<EventEnvelope> events = stream.toList();
    assertEquals(5, events.size());
    assertEquals(3, events.get(0).version());
    assertEquals(7, events.get(4).version());
    assertEquals(events, stream.toList());
  }

  @Test
  void readIsBoundedByVersionAtCallTime() {
    journal.append("acct-1", 0, TestEvents.events(2));
    EventStream stream = journal.read("acct-1", 1);

    journal.append("acct-1", 2, TestEvents.events(2));

    assertEquals(2, stream.toList().size());
    assertEquals(4, journal.read("acct-1", 1).toList().size());
  }

  @Test
  void readOfUnknownStreamIsEmpty() {
    EventStream stream = journal.read("missing", 1);
    assertTrue(stream.isEmpty());
    assertFalse(stream.iterator().hasNext());
  }

  @Test
  void readRangeIsInclusive() {
    journal.append("acct-1", 0, TestEvents.events(6));

    List<EventEnvelope> events = journal.read("acct-1", 2, 4).toList();

    assertEquals(List.of(2L, 3L, 4L), events.stream().map(EventEnvelope::version).toList());
  }

  @Test
  void metadataSurvivesAppend() {
    NewEvent cause = NewEvent.builder("Requested").payloadJson("{}").correlationId("req-7").build();
    journal.append("acct-1", 0, List.of(cause));
    EventEnvelope stored = journal.read("acct-1", 1).toList().get(0);

    NewEvent effect = NewEvent.builder("Fulfilled").payloadJson("{}").causedBy(stored).build();
    journal.append("acct-1", 1, List.of(effect));
    EventEnvelope second = journal.read("acct-1", 2).toList().get(0);

    assertEquals("req-7", stored.correlationId());
    assertEquals(cause.eventId(), stored.eventId());
    assertEquals("req-7", second.correlationId());
    assertEquals(stored.eventId(), second.causationId());
  }

  @Test
  void readAllFollowsCommitOrderAcrossStreams() {
    journal.append("b", 0, TestEvents.events(1));
    journal.append("a", 0, TestEvents.events(2));
    journal.append("b", 1, TestEvents.events(1));

    List<JournalRecord> records = journal.readAll(0, 10);

    assertEquals(4, records.size());
    assertEquals(List.of("b", "a", "a", "b"), records.stream().map(r -> r.event().streamId()).toList());
    assertEquals(4, journal.headPosition());
    assertEquals(2, journal.readAll(2, 10).size());
  }

  @Test
  void streamIdsAreListedInOrder() {
    journal.append("c", 0, TestEvents.events(1));
    journal.append("a", 0, TestEvents.events(1));
    journal.append("b", 0, TestEvents.events(1));

    assertEquals(List.of("a", "b"), journal.streamIds(null, 2));
    assertEquals(List.of("c"), journal.streamIds("b", 2));
  }

  @Test
  void erasePayloadsKeepsOrdering() {
    journal.append("acct-1", 0, TestEvents.events(3));

    assertEquals(3, journal.erasePayloads("acct-1"));
    List<EventEnvelope> events = journal.read("acct-1", 1).toList();

    assertEquals(3, events.size());
    for (EventEnvelope event : events) {
      assertTrue(event.payloadErased());
      assertEquals(0, event.payload().length);
    }
    assertEquals(0, journal.erasePayloads("acct-1"));
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> EventJournal.builder().store(store).build());
    assertThrows(IllegalArgumentException.class, () -> EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider()).store(store).pageSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider()).store(store).maxStorageAttempts(0).build());
  }
}
