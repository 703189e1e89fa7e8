package eventjournal.aggregate;

import eventjournal.EventEnvelope;

/**
 * Pure state transition for one event type: {@code (state, event) -> state}.
 *
 * <p>Handlers must be deterministic and free of I/O; rehydration replays them and
 * expects the same result every time.
 *
 * @param <S> the aggregate state type
 */
@FunctionalInterface
public interface EventHandler<S> {

  S apply(S state, EventEnvelope event);
}
