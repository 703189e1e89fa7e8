package eventjournal.aggregate;

import eventjournal.EventEnvelope;
import eventjournal.EventType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Explicit {@code type -> handler} table of an aggregate.
 *
 * <p>Folding an event whose type has no handler fails fast with
 * {@link IllegalStateException}: silently skipping it would produce a state that
 * differs from the history.
 *
 * <pre>{@code
 * EventHandlers<Account> handlers = EventHandlers.<Account>builder()
 *     .on(AccountEvents.DEPOSITED, (account, e) -> account.deposit(amountOf(e)))
 *     .on(AccountEvents.WITHDRAWN, (account, e) -> account.withdraw(amountOf(e)))
 *     .build();
 * }</pre>
 *
 * @param <S> the aggregate state type
 */
public final class EventHandlers<S> {
  private final Map<String, EventHandler<S>> handlers;

  private EventHandlers(Map<String, EventHandler<S>> handlers) {
    this.handlers = Map.copyOf(handlers);
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  /**
   * Folds one event into the state.
   *
   * @throws IllegalStateException if no handler is registered for the event type
   */
  public S apply(S state, EventEnvelope event) {
    EventHandler<S> handler = handlers.get(event.type());
    if (handler == null) {
      throw new IllegalStateException("No handler for event type '" + event.type()
          + "' (stream " + event.streamId() + ", version " + event.version() + ")");
    }
    return handler.apply(state, event);
  }

  public boolean handles(String type) {
    return handlers.containsKey(type);
  }

  public Set<String> types() {
    return handlers.keySet();
  }

  /** Builder for {@link EventHandlers}. */
  public static final class Builder<S> {
    private final Map<String, EventHandler<S>> handlers = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder<S> on(EventType type, EventHandler<S> handler) {
      Objects.requireNonNull(type, "type");
      return on(type.name(), handler);
    }

    /**
     * Registers the handler of an event type.
     *
     * @throws IllegalArgumentException if the type already has a handler
     */
    public Builder<S> on(String type, EventHandler<S> handler) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(type, handler) != null) {
        throw new IllegalArgumentException("Duplicate handler for event type: " + type);
      }
      return this;
    }

    public EventHandlers<S> build() {
      if (handlers.isEmpty()) {
        throw new IllegalStateException("At least one handler must be registered");
      }
      return new EventHandlers<>(handlers);
    }
  }
}
