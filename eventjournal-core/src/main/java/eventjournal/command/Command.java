package eventjournal.command;

import eventjournal.NewEvent;

import java.util.List;

/**
 * Business decision against the current state of one aggregate.
 *
 * <p>{@code decide} may run several times for one execution when concurrent writers
 * move the stream on; it must not have side effects beyond returning events.
 * Validation failures are signalled by throwing, and reach the caller unchanged.
 *
 * @param <S> the aggregate state type
 */
@FunctionalInterface
public interface Command<S> {

  /**
   * @param state   the rehydrated state
   * @param version the stream version {@code state} reflects
   * @return the events to append, possibly empty
   */
  List<NewEvent> decide(S state, long version);
}
