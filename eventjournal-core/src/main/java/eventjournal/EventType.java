package eventjournal;

/**
 * Identifies the type of a journal event.
 *
 * <p>Enums make a natural implementation because {@link Enum#name()} already
 * satisfies the contract:
 * <pre>{@code
 * public enum AccountEvents implements EventType {
 *   DEPOSITED,
 *   WITHDRAWN
 * }
 * }</pre>
 *
 * <p>Use {@link StringEventType} when the type is only known at runtime.
 */
public interface EventType {

  /**
   * Returns the persisted type name. Handler tables are keyed by this value.
   *
   * @return the event type name, never null
   */
  String name();
}
