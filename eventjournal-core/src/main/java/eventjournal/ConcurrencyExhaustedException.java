package eventjournal;

/**
 * Thrown when a command kept losing the optimistic race for its stream and the
 * retry budget ran out. The last {@link VersionConflictException} is the cause.
 */
public class ConcurrencyExhaustedException extends JournalException {

  private final String streamId;
  private final int attempts;

  public ConcurrencyExhaustedException(String streamId, int attempts, VersionConflictException lastConflict) {
    super("Gave up on stream " + streamId + " after " + attempts + " conflicting attempts", lastConflict);
    this.streamId = streamId;
    this.attempts = attempts;
  }

  public String streamId() {
    return streamId;
  }

  public int attempts() {
    return attempts;
  }
}
