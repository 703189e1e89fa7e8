package eventjournal.aggregate;

import java.util.Objects;

/**
 * Aggregate state folded up to a stream version.
 *
 * @param streamId        the stream
 * @param state           the folded state
 * @param version         the version of the last folded event (0 for an empty stream)
 * @param snapshotVersion the version of the snapshot the fold started from, 0 if none
 * @param <S>             the aggregate state type
 */
public record Rehydrated<S>(String streamId, S state, long version, long snapshotVersion) {

  public Rehydrated {
    Objects.requireNonNull(streamId, "streamId");
  }

  /**
   * Returns how many journal events were folded on top of the snapshot.
   */
  public long replayedEvents() {
    return version - snapshotVersion;
  }
}
