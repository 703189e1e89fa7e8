package eventjournal.jdbc;

import eventjournal.EventEnvelope;
import eventjournal.Journal;
import eventjournal.JournalConfig;
import eventjournal.NewEvent;
import eventjournal.aggregate.AggregateDefinition;
import eventjournal.aggregate.EventHandlers;
import eventjournal.aggregate.StateCodec;
import eventjournal.command.Command;
import eventjournal.command.ConcurrencyController;
import eventjournal.dlq.RedriveResult;
import eventjournal.jdbc.dialect.Dialects;
import eventjournal.model.DeadLetterSummary;
import eventjournal.projection.ProjectionHandlers;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bank account flow over H2: commands append to the journal, a balance read model is
 * maintained through the projection's connection, and a broken read model quarantines
 * only the affected account until it is redriven. Balance rows carry the version they
 * were last updated from, so a repeated event is a no-op.
 */
class JdbcJournalAcceptanceTest {
  private JdbcDataSource dataSource;
  private JdbcStores stores;
  private Journal journal;
  private final ConcurrentHashMap<String, Long> faults = new ConcurrentHashMap<>();
  private final AtomicInteger resets = new AtomicInteger();

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:acceptance_" + System.nanoTime() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    stores = JdbcStores.create(Dialects.get("h2"));
    stores.createSchema(dataSource);
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute(
          "CREATE TABLE account_balance (account_id VARCHAR(64) PRIMARY KEY, balance BIGINT NOT NULL,"
              + " last_version BIGINT NOT NULL)");
    }
    journal = newJournal();
  }

  @AfterEach
  void tearDown() {
    if (journal != null) {
      journal.close();
    }
  }

  private Journal newJournal() {
    Journal j = stores.configure(Journal.builder())
        .connectionProvider(dataSource::getConnection)
        .config(new JournalConfig().setStorageRetryBaseDelayMs(1).setStorageRetryMaxDelayMs(1))
        .build();
    j.registerProjection("balances", balances());
    return j;
  }

  private ProjectionHandlers balances() {
    return ProjectionHandlers.builder()
        .on("Deposited", (conn, event) -> addToBalance(conn, event, amount(event)))
        .on("Withdrawn", (conn, event) -> addToBalance(conn, event, -amount(event)))
        .onReset(conn -> {
          resets.incrementAndGet();
          conn.createStatement().executeUpdate("DELETE FROM account_balance");
        })
        .build();
  }

  private void addToBalance(Connection conn, EventEnvelope event, long delta) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "UPDATE account_balance SET balance = balance + ?, last_version = ?"
            + " WHERE account_id = ? AND last_version < ?")) {
      ps.setLong(1, delta);
      ps.setLong(2, event.version());
      ps.setString(3, event.streamId());
      ps.setLong(4, event.version());
      if (ps.executeUpdate() == 0 && balance(conn, event.streamId()) == null) {
        try (PreparedStatement insert = conn.prepareStatement(
            "INSERT INTO account_balance (account_id, balance, last_version) VALUES (?, ?, ?)")) {
          insert.setString(1, event.streamId());
          insert.setLong(2, delta);
          insert.setLong(3, event.version());
          insert.executeUpdate();
        }
      }
    }
    // fails after the write so the rollback is observable
    Long poisoned = faults.get(event.streamId());
    if (poisoned != null && poisoned == event.version()) {
      throw new SQLException("read model unavailable");
    }
  }

  private Long balance(String accountId) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return balance(conn, accountId);
    }
  }

  private static Long balance(Connection conn, String accountId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("SELECT balance FROM account_balance WHERE account_id = ?")) {
      ps.setString(1, accountId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : null;
      }
    }
  }

  private static long amount(EventEnvelope event) {
    String json = event.payloadJson();
    return Long.parseLong(json.substring(json.indexOf(':') + 1, json.indexOf('}')).trim());
  }

  private static NewEvent deposited(long amount) {
    return NewEvent.ofJson("Deposited", "{\"amount\":" + amount + "}");
  }

  private static NewEvent withdrawn(long amount) {
    return NewEvent.ofJson("Withdrawn", "{\"amount\":" + amount + "}");
  }

  private static AggregateDefinition<Long> accounts() {
    return AggregateDefinition.<Long>builder("account")
        .initialState(() -> 0L)
        .handlers(EventHandlers.<Long>builder()
            .on("Deposited", (balance, event) -> balance + amount(event))
            .on("Withdrawn", (balance, event) -> balance - amount(event))
            .build())
        .codec(new StateCodec<>() {
          @Override
          public byte[] encode(Long state) {
            return Long.toString(state).getBytes(StandardCharsets.UTF_8);
          }

          @Override
          public Long decode(byte[] bytes) {
            return Long.parseLong(new String(bytes, StandardCharsets.UTF_8));
          }
        })
        .streamPrefix("acct-")
        .build();
  }

  private static Command<Long> deposit(long amount) {
    return (balance, version) -> List.of(deposited(amount));
  }

  private static Command<Long> withdraw(long amount) {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be positive");
    }
    return (balance, version) -> {
      if (balance < amount) {
        throw new IllegalStateException("insufficient funds");
      }
      return List.of(withdrawn(amount));
    };
  }

  @Test
  void brokenReadModelQuarantinesOneAccountUntilRedriven() throws Exception {
    ConcurrencyController<Long> commands = journal.commands(accounts());
    commands.execute("acct-42", deposit(100));
    commands.execute("acct-42", withdraw(30));
    assertEquals(70L, journal.rehydrator(accounts()).rehydrate("acct-42").state());

    faults.put("acct-42", 2L);
    journal.tail();

    assertEquals(100L, balance("acct-42"));
    List<DeadLetterSummary> open = journal.listDeadLetters();
    assertEquals(1, open.size());
    assertEquals("balances.v1", open.get(0).projectionName());
    assertEquals("acct-42", open.get(0).streamId());
    assertEquals(2, open.get(0).failedAtVersion());
    assertTrue(open.get(0).reason().contains("read model unavailable"));

    commands.execute("acct-42", deposit(10));
    commands.execute("acct-99", deposit(5));
    journal.tail();

    assertEquals(100L, balance("acct-42"));
    assertEquals(5L, balance("acct-99"));
    assertEquals(2, journal.listDeadLetters().get(0).queuedCount());

    faults.clear();
    assertEquals(new RedriveResult.Success("acct-42", 2, 3), journal.redrive("acct-42"));

    assertEquals(80L, balance("acct-42"));
    assertTrue(journal.listDeadLetters().isEmpty());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(3, stores.checkpointStore().lastApplied(conn, "balances.v1", "acct-42"));
      assertTrue(stores.deadLetterStore().listAll(conn).isEmpty());
    }
  }

  @Test
  void commandValidationFailuresAppendNothing() {
    ConcurrencyController<Long> commands = journal.commands(accounts());
    commands.execute("acct-1", deposit(10));

    assertThrows(IllegalStateException.class, () -> commands.execute("acct-1", withdraw(50)));
    assertThrows(IllegalArgumentException.class, () -> withdraw(0));
    assertEquals(1, journal.currentVersion("acct-1"));
  }

  @Test
  void quarantineSurvivesRestart() throws Exception {
    journal.append("acct-7", 0, deposited(10), deposited(20));
    faults.put("acct-7", 2L);
    journal.tail();
    assertEquals(1, journal.listDeadLetters().size());
    journal.close();

    journal = newJournal();
    List<DeadLetterSummary> open = journal.listDeadLetters();
    assertEquals(1, open.size());
    assertEquals(2, open.get(0).failedAtVersion());

    journal.append("acct-7", 2, deposited(5));
    journal.tail();
    assertEquals(10L, balance("acct-7"));
    assertEquals(2, journal.listDeadLetters().get(0).queuedCount());

    faults.clear();
    assertEquals(new RedriveResult.Success("acct-7", 2, 3), journal.redrive("balances", "acct-7"));
    assertEquals(35L, balance("acct-7"));
  }

  @Test
  void appendJoinsCallerTransaction() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      journal.eventJournal().append(conn, "acct-5", 0, List.of(deposited(1)));
      conn.rollback();
    }
    assertEquals(0, journal.currentVersion("acct-5"));

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      journal.eventJournal().append(conn, "acct-5", 0, List.of(deposited(1)));
      conn.commit();
    }
    assertEquals(1, journal.currentVersion("acct-5"));
  }

  @Test
  void replayRebuildsReadModel() throws Exception {
    journal.append("acct-1", 0, deposited(10), withdrawn(4));
    journal.append("acct-2", 0, deposited(3));
    journal.tail();
    assertEquals(6L, balance("acct-1"));

    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().executeUpdate("UPDATE account_balance SET balance = -1");
    }
    journal.projections().reset("balances", 1);
    assertNull(balance("acct-1"));
    assertEquals(3, journal.replay("balances"));

    assertEquals(1, resets.get());
    assertEquals(6L, balance("acct-1"));
    assertEquals(3L, balance("acct-2"));
  }

  @Test
  void replayOverLiveReadModelKeepsBalances() throws Exception {
    ConcurrencyController<Long> commands = journal.commands(accounts());
    commands.execute("acct-42", deposit(100));
    journal.tail();

    assertEquals(1, journal.replay("balances"));

    assertEquals(100L, balance("acct-42"));
    assertEquals(0, resets.get());
  }

  @Test
  void eraseKeepsStreamVersion() {
    ConcurrencyController<Long> commands = journal.commands(accounts());
    commands.execute("acct-3", deposit(10));
    commands.execute("acct-3", deposit(10));

    assertEquals(2, journal.erase("acct-3"));

    assertEquals(2, journal.currentVersion("acct-3"));
    List<EventEnvelope> events = journal.read("acct-3", 1).toList();
    assertTrue(events.stream().allMatch(e -> e.payloadErased() && e.payload().length == 0));
    assertTrue(journal.snapshot("acct-3").isEmpty());
  }
}
