package eventjournal;

import java.util.Objects;

/**
 * String-backed {@link EventType} for types resolved at runtime.
 */
public final class StringEventType implements EventType {

  private final String name;

  private StringEventType(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Event type name cannot be empty");
    }
  }

  public static StringEventType of(String name) {
    return new StringEventType(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringEventType that)) return false;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
