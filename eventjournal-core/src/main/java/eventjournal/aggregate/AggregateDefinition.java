package eventjournal.aggregate;

import eventjournal.EventEnvelope;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Describes how to rebuild one kind of aggregate from its events.
 *
 * <p>Required: an initial state supplier and the {@link EventHandlers} table. Optional:
 * a {@link StateCodec} (without one, the aggregate is never snapshotted) and a
 * stream id prefix that tells background jobs which streams belong to this aggregate.
 *
 * @param <S> the aggregate state type
 */
public final class AggregateDefinition<S> {
  private final String name;
  private final Supplier<S> initialState;
  private final EventHandlers<S> handlers;
  private final StateCodec<S> codec;
  private final String streamPrefix;

  private AggregateDefinition(Builder<S> builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.initialState = Objects.requireNonNull(builder.initialState, "initialState");
    this.handlers = Objects.requireNonNull(builder.handlers, "handlers");
    this.codec = builder.codec;
    this.streamPrefix = builder.streamPrefix;
  }

  public static <S> Builder<S> builder(String name) {
    return new Builder<>(name);
  }

  public String name() {
    return name;
  }

  public S initialState() {
    return initialState.get();
  }

  public S apply(S state, EventEnvelope event) {
    return handlers.apply(state, event);
  }

  public EventHandlers<S> handlers() {
    return handlers;
  }

  /**
   * Returns the snapshot codec, or {@code null} when the aggregate is not snapshotted.
   */
  public StateCodec<S> codec() {
    return codec;
  }

  public boolean snapshotsSupported() {
    return codec != null;
  }

  /**
   * Returns whether a stream holds events of this aggregate. Without a configured
   * prefix every stream matches.
   */
  public boolean owns(String streamId) {
    return streamPrefix == null || streamId.startsWith(streamPrefix);
  }

  @Override
  public String toString() {
    return "AggregateDefinition{" + name + '}';
  }

  /** Builder for {@link AggregateDefinition}. */
  public static final class Builder<S> {
    private final String name;
    private Supplier<S> initialState;
    private EventHandlers<S> handlers;
    private StateCodec<S> codec;
    private String streamPrefix;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Sets the state of a stream with no events (version 0).
     *
     * <p><b>Required.</b>
     */
    public Builder<S> initialState(Supplier<S> initialState) {
      this.initialState = initialState;
      return this;
    }

    /**
     * Sets the {@code type -> handler} table.
     *
     * <p><b>Required.</b>
     */
    public Builder<S> handlers(EventHandlers<S> handlers) {
      this.handlers = handlers;
      return this;
    }

    /**
     * Enables snapshots by supplying a state codec.
     *
     * <p>Optional. Without a codec rehydration always replays the full stream.
     */
    public Builder<S> codec(StateCodec<S> codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Restricts the aggregate to stream ids starting with {@code streamPrefix}.
     *
     * <p>Optional. Used by the snapshot compaction job to pick streams.
     */
    public Builder<S> streamPrefix(String streamPrefix) {
      this.streamPrefix = streamPrefix;
      return this;
    }

    public AggregateDefinition<S> build() {
      return new AggregateDefinition<>(this);
    }
  }
}
