package eventjournal.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Serialized aggregate state as of a stream version.
 *
 * @param streamId the stream the state belongs to
 * @param version  the stream version the state represents
 * @param state    opaque serialized state
 * @param takenAt  when the snapshot was taken
 */
public record Snapshot(String streamId, long version, byte[] state, Instant takenAt) {

  public Snapshot {
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(takenAt, "takenAt");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + version);
    }
    state = Arrays.copyOf(state, state.length);
  }

  @Override
  public byte[] state() {
    return Arrays.copyOf(state, state.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Snapshot that)) return false;
    return version == that.version
        && streamId.equals(that.streamId)
        && Arrays.equals(state, that.state)
        && takenAt.equals(that.takenAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(streamId, version, takenAt);
  }

  @Override
  public String toString() {
    return "Snapshot{streamId=" + streamId + ", version=" + version + ", takenAt=" + takenAt + '}';
  }
}
