package eventjournal;

/**
 * Thrown when journal or snapshot storage is still unavailable after the bounded
 * backoff at the journal boundary. Committed state is never affected: an append
 * either commits its whole batch or nothing.
 */
public class StorageFailureException extends JournalException {

  private final int attempts;

  public StorageFailureException(String message, int attempts, Throwable cause) {
    super(message + " (after " + attempts + " attempts)", cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
