package eventjournal.aggregate;

import eventjournal.journal.EventJournal;
import eventjournal.model.Snapshot;
import eventjournal.support.Accounts;
import eventjournal.support.CountingMetrics;
import eventjournal.support.InMemoryJournalStore;
import eventjournal.support.InMemorySnapshotStore;
import eventjournal.support.MutableClock;
import eventjournal.support.TestConnections;
import eventjournal.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RehydratorTest {

  private InMemoryJournalStore journalStore;
  private InMemorySnapshotStore snapshotStore;
  private CountingMetrics metrics;
  private EventJournal journal;
  private SnapshotManager snapshots;

  @BeforeEach
  void setUp() {
    journalStore = new InMemoryJournalStore();
    snapshotStore = new InMemorySnapshotStore();
    metrics = new CountingMetrics();
    journal = EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .store(journalStore)
        .retryPolicy(attempts -> 0L)
        .maxStorageAttempts(1)
        .build();
    snapshots = new SnapshotManager(TestConnections.dummyProvider(), snapshotStore, metrics,
        new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
  }

  private Rehydrator<Long> rehydrator(long everyEvents) {
    return Rehydrator.<Long>builder()
        .journal(journal)
        .aggregate(Accounts.definition())
        .snapshots(snapshots)
        .policy(new SnapshotPolicy(everyEvents, Duration.ofHours(1)))
        .build();
  }

  @Test
  void foldsFullHistory() {
    journal.append("acct-42", 0, List.of(Accounts.deposited(100), Accounts.withdrawn(30)));

    Rehydrated<Long> result = rehydrator(1000).rehydrate("acct-42");

    assertEquals(70L, result.state());
    assertEquals(2, result.version());
    assertEquals(0, result.snapshotVersion());
    assertEquals(2, result.replayedEvents());
  }

  @Test
  void unknownStreamYieldsInitialState() {
    Rehydrated<Long> result = rehydrator(1000).rehydrate("acct-none");

    assertEquals(0L, result.state());
    assertEquals(0, result.version());
  }

  @Test
  void savesSnapshotWhenDueAndStartsFromIt() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(10), Accounts.deposited(20), Accounts.deposited(30)));
    Rehydrator<Long> rehydrator = rehydrator(3);

    rehydrator.rehydrate("acct-1");
    Snapshot snapshot = snapshotStore.loadLatest(null, "acct-1").orElseThrow();
    assertEquals(3, snapshot.version());
    assertEquals("60", new String(snapshot.state(), StandardCharsets.UTF_8));
    assertEquals(1, metrics.count("snapshotSaved"));

    journal.append("acct-1", 3, List.of(Accounts.withdrawn(5)));
    Rehydrated<Long> result = rehydrator.rehydrate("acct-1");

    assertEquals(55L, result.state());
    assertEquals(4, result.version());
    assertEquals(3, result.snapshotVersion());
    assertEquals(1, result.replayedEvents());
  }

  @Test
  void snapshotAndFullReplayAgree() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(10), Accounts.deposited(20), Accounts.withdrawn(7)));
    Rehydrator<Long> rehydrator = rehydrator(2);
    rehydrator.rehydrate("acct-1");
    journal.append("acct-1", 3, List.of(Accounts.deposited(1)));

    Rehydrated<Long> fromSnapshot = rehydrator.rehydrate("acct-1");
    Rehydrated<Long> fullReplay = rehydrator.rehydrate("acct-1", false);

    assertEquals(fullReplay.state(), fromSnapshot.state());
    assertEquals(fullReplay.version(), fromSnapshot.version());
    assertEquals(0, fullReplay.snapshotVersion());
  }

  @Test
  void corruptSnapshotFallsBackToFullReplay() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(10), Accounts.deposited(20)));
    snapshotStore.put(new Snapshot("acct-1", 2, "not-a-number".getBytes(StandardCharsets.UTF_8), Instant.now()));

    Rehydrated<Long> result = rehydrator(2).rehydrate("acct-1");

    assertEquals(30L, result.state());
    assertEquals(0, result.snapshotVersion());
    // the unreadable snapshot is replaced
    assertEquals("30", new String(snapshotStore.loadLatest(null, "acct-1").orElseThrow().state(),
        StandardCharsets.UTF_8));
  }

  @Test
  void unavailableSnapshotStoreFallsBackToFullReplay() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(10)));
    snapshotStore.setFailLoads(true);

    assertEquals(10L, rehydrator(1000).rehydrate("acct-1").state());
  }

  @Test
  void aggregateWithoutCodecNeverSnapshots() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(10), Accounts.deposited(10)));
    Rehydrator<Long> rehydrator = Rehydrator.<Long>builder()
        .journal(journal)
        .aggregate(Accounts.withoutSnapshots())
        .snapshots(snapshots)
        .policy(new SnapshotPolicy(1, Duration.ofHours(1)))
        .build();

    assertEquals(20L, rehydrator.rehydrate("acct-1").state());
    assertEquals(0, snapshotStore.size());
  }

  @Test
  void unknownEventTypeFails() {
    journal.append("acct-1", 0, TestEvents.events(1));

    assertThrows(IllegalStateException.class, () -> rehydrator(1000).rehydrate("acct-1"));
  }

  @Test
  void versionGapFails() {
    journalStore.appendRaw(Accounts.deposited(1).toEnvelope("acct-1", 1));
    journalStore.appendRaw(Accounts.deposited(1).toEnvelope("acct-1", 3));

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> rehydrator(1000).rehydrate("acct-1", false));
    assertTrue(e.getMessage().contains("skips"), e.getMessage());
  }
}
