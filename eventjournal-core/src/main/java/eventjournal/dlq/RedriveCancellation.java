package eventjournal.dlq;

/**
 * Cancellation token for a running redrive.
 *
 * <p>The redrive checks the token before each event; an event that already started
 * applying always finishes.
 */
public final class RedriveCancellation {
  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
