package eventjournal.support;

import eventjournal.EventEnvelope;
import eventjournal.projection.Projection;

import java.sql.Connection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read model of account balances with injectable apply faults.
 *
 * <p>Each account row keeps the version it was last updated from, and events at or
 * below it are ignored, so a redelivered or replayed event leaves the balance alone.
 */
public class BalanceProjection implements Projection {
  private final Map<String, Account> accounts = new ConcurrentHashMap<>();
  private final Map<String, Long> faults = new ConcurrentHashMap<>();

  public void failOn(String streamId, long version) {
    faults.put(streamId, version);
  }

  public void clearFaults() {
    faults.clear();
  }

  public long balance(String streamId) {
    Account account = accounts.get(streamId);
    return account == null ? 0L : account.balance;
  }

  @Override
  public void apply(Connection conn, EventEnvelope event) {
    Long faulty = faults.get(event.streamId());
    if (faulty != null && faulty == event.version()) {
      throw new IllegalStateException("read model unavailable");
    }
    long amount = Accounts.amount(event);
    long delta = Accounts.DEPOSITED.equals(event.type()) ? amount : -amount;
    accounts.compute(event.streamId(), (id, account) -> {
      if (account == null) {
        return new Account(delta, event.version());
      }
      return account.version >= event.version() ? account : new Account(account.balance + delta, event.version());
    });
  }

  @Override
  public void reset(Connection conn) {
    accounts.clear();
  }

  private static final class Account {
    final long balance;
    final long version;

    Account(long balance, long version) {
      this.balance = balance;
      this.version = version;
    }
  }
}
