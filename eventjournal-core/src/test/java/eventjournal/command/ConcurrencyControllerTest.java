package eventjournal.command;

import eventjournal.ConcurrencyExhaustedException;
import eventjournal.NewEvent;
import eventjournal.aggregate.Rehydrator;
import eventjournal.journal.EventJournal;
import eventjournal.support.Accounts;
import eventjournal.support.CountingMetrics;
import eventjournal.support.InMemoryJournalStore;
import eventjournal.support.TestConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyControllerTest {

  private EventJournal journal;
  private CountingMetrics metrics;
  private Rehydrator<Long> rehydrator;

  @BeforeEach
  void setUp() {
    metrics = new CountingMetrics();
    journal = EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .store(new InMemoryJournalStore())
        .retryPolicy(attempts -> 0L)
        .metrics(metrics)
        .build();
    rehydrator = Rehydrator.<Long>builder()
        .journal(journal)
        .aggregate(Accounts.withoutSnapshots())
        .build();
  }

  private ConcurrencyController<Long> controller(int maxAttempts, boolean serializeLocally) {
    return ConcurrencyController.<Long>builder()
        .rehydrator(rehydrator)
        .journal(journal)
        .maxAttempts(maxAttempts)
        .serializeLocally(serializeLocally)
        .metrics(metrics)
        .build();
  }

  private static Command<Long> withdraw(long amount) {
    return (balance, version) -> {
      if (balance < amount) {
        throw new IllegalStateException("insufficient funds");
      }
      return List.of(Accounts.withdrawn(amount));
    };
  }

  @Test
  void decidesAgainstCurrentStateAndCommits() {
    journal.append("acct-42", 0, List.of(Accounts.deposited(100)));

    CommandResult result = controller(3, false).execute("acct-42", withdraw(30));

    assertTrue(result.committed());
    assertEquals(2, result.committedVersion());
    assertEquals(1, result.attempts());
    assertEquals(1, result.events().size());
    assertEquals(2, result.events().get(0).version());
    assertEquals(70L, rehydrator.rehydrate("acct-42").state());
  }

  @Test
  void emptyDecisionCommitsNothing() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(5)));

    CommandResult result = controller(3, false).execute("acct-1", (balance, version) -> List.of());

    assertFalse(result.committed());
    assertEquals(1, result.committedVersion());
    assertEquals(1, journal.currentVersion("acct-1"));
  }

  @Test
  void conflictIsRetriedAgainstFreshState() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(100)));
    AtomicInteger calls = new AtomicInteger();
    Command<Long> racing = (balance, version) -> {
      if (calls.incrementAndGet() == 1) {
        // another writer commits between rehydrate and append
        journal.append("acct-1", version, List.of(Accounts.withdrawn(60)));
      }
      return List.of(Accounts.withdrawn(balance / 2));
    };

    CommandResult result = controller(3, false).execute("acct-1", racing);

    assertEquals(2, result.attempts());
    assertEquals(3, result.committedVersion());
    assertEquals(20L, rehydrator.rehydrate("acct-1").state());
    assertEquals(1, metrics.count("conflict"));
  }

  @Test
  void givesUpAfterMaxAttempts() {
    journal.append("acct-1", 0, List.of(Accounts.deposited(100)));
    Command<Long> alwaysLoses = (balance, version) -> {
      journal.append("acct-1", version, List.of(Accounts.deposited(1)));
      return List.of(Accounts.withdrawn(1));
    };

    ConcurrencyExhaustedException e = assertThrows(ConcurrencyExhaustedException.class,
        () -> controller(3, false).execute("acct-1", alwaysLoses));

    assertEquals("acct-1", e.streamId());
    assertEquals(3, e.attempts());
    assertEquals(1, metrics.count("exhausted"));
    assertEquals(4, journal.currentVersion("acct-1"));
  }

  @Test
  void commandExceptionsPropagate() {
    assertThrows(IllegalStateException.class, () -> controller(3, false).execute("acct-empty", withdraw(10)));
    assertEquals(0, journal.currentVersion("acct-empty"));
  }

  @Test
  void localSerializationAvoidsInProcessConflicts() throws Exception {
    ConcurrencyController<Long> controller = controller(1, true);
    int writers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<CommandResult>> futures = new java.util.ArrayList<>();
      for (int i = 0; i < writers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return controller.execute("acct-hot", (balance, version) -> List.of(NewEvent.ofJson(
              Accounts.DEPOSITED, "{\"amount\":1}")));
        }));
      }
      start.countDown();
      for (Future<CommandResult> future : futures) {
        assertTrue(future.get(10, TimeUnit.SECONDS).committed());
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(writers, journal.currentVersion("acct-hot"));
    assertEquals((long) writers, rehydrator.rehydrate("acct-hot").state());
    assertEquals(0, metrics.count("conflict"));
  }

  @Test
  void rejectsNonPositiveMaxAttempts() {
    assertThrows(IllegalArgumentException.class, () -> controller(0, false));
  }
}
