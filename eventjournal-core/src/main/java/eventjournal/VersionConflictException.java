package eventjournal;

/**
 * Thrown when an append names an expected version that no longer matches the
 * stream's current version.
 *
 * <p>Recoverable: the caller re-rehydrates the aggregate, re-validates the command
 * against the fresh state, and appends again.
 * {@link eventjournal.command.ConcurrencyController} does this automatically.
 */
public class VersionConflictException extends JournalException {

  private final String streamId;
  private final long expectedVersion;
  private final long actualVersion;

  public VersionConflictException(String streamId, long expectedVersion, long actualVersion) {
    super("Version conflict on stream " + streamId
        + ": expected " + expectedVersion + " but was " + actualVersion);
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String streamId() {
    return streamId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }

  /**
   * Returns the version observed when the conflict was detected, or {@code -1}
   * when the store could not determine it.
   *
   * @return the actual stream version
   */
  public long actualVersion() {
    return actualVersion;
  }
}
