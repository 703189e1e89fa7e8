package eventjournal.dlq;

/**
 * Result of redriving the quarantined tail of a stream.
 *
 * <pre>{@code
 * RedriveResult result = runner.redrive("acct-42");
 * if (result instanceof RedriveResult.Partial p) {
 *   alert(p.streamId(), p.failedAtVersion(), p.reason());
 * }
 * }</pre>
 */
public sealed interface RedriveResult {

  String streamId();

  /**
   * Every queued event was applied; the entry is closed and the stream flows again.
   *
   * @param appliedEvents     number of events applied by this redrive
   * @param checkpointVersion the checkpoint after the redrive
   */
  record Success(String streamId, int appliedEvents, long checkpointVersion) implements RedriveResult {
  }

  /**
   * Applying {@code failedAtVersion} failed. Events before it stay applied; the stream
   * remains quarantined from that version on.
   */
  record Partial(String streamId, long failedAtVersion, int appliedEvents, String reason) implements RedriveResult {
  }

  /**
   * The redrive was cancelled before {@code nextVersion}; the stream remains
   * quarantined from that version on.
   */
  record Cancelled(String streamId, long nextVersion, int appliedEvents) implements RedriveResult {
  }

  /**
   * The stream has no open dead-letter entry.
   */
  record NotQuarantined(String streamId) implements RedriveResult {
  }

  /**
   * Another redrive of the same stream is in progress.
   */
  record AlreadyRunning(String streamId) implements RedriveResult {
  }
}
