package eventjournal.aggregate;

/**
 * Serializes aggregate state for snapshots.
 *
 * <p>{@link #decode} may throw any runtime exception for bytes it cannot read (for
 * instance a snapshot written by an older state layout); the rehydrator then ignores
 * the snapshot and replays the stream from the start.
 *
 * @param <S> the aggregate state type
 */
public interface StateCodec<S> {

  byte[] encode(S state);

  S decode(byte[] bytes);
}
