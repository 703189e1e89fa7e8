package eventjournal.projection;

import eventjournal.EventEnvelope;
import eventjournal.EventType;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Projection} backed by an explicit {@code type -> handler} table.
 *
 * <p>Events of types without a handler are ignored, since most projections only care
 * about part of the journal. In strict mode they fail instead, which quarantines the
 * stream.
 */
public final class ProjectionHandlers implements Projection {
  private final Map<String, ProjectionHandler> handlers;
  private final ResetHandler resetHandler;
  private final boolean strict;

  private ProjectionHandlers(Builder builder) {
    this.handlers = Map.copyOf(builder.handlers);
    this.resetHandler = builder.resetHandler;
    this.strict = builder.strict;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void apply(Connection conn, EventEnvelope event) throws SQLException {
    ProjectionHandler handler = handlers.get(event.type());
    if (handler != null) {
      handler.handle(conn, event);
    } else if (strict) {
      throw new IllegalStateException("No projection handler for event type: " + event.type());
    }
  }

  @Override
  public void reset(Connection conn) throws SQLException {
    if (resetHandler != null) {
      resetHandler.reset(conn);
    }
  }

  public boolean handles(String type) {
    return handlers.containsKey(type);
  }

  /** Drops read-model rows before a rebuild. */
  @FunctionalInterface
  public interface ResetHandler {
    void reset(Connection conn) throws SQLException;
  }

  /** Builder for {@link ProjectionHandlers}. */
  public static final class Builder {
    private final Map<String, ProjectionHandler> handlers = new LinkedHashMap<>();
    private ResetHandler resetHandler;
    private boolean strict;

    private Builder() {
    }

    public Builder on(EventType type, ProjectionHandler handler) {
      Objects.requireNonNull(type, "type");
      return on(type.name(), handler);
    }

    /**
     * @throws IllegalArgumentException if the type already has a handler
     */
    public Builder on(String type, ProjectionHandler handler) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(type, handler) != null) {
        throw new IllegalArgumentException("Duplicate projection handler for event type: " + type);
      }
      return this;
    }

    public Builder onReset(ResetHandler resetHandler) {
      this.resetHandler = resetHandler;
      return this;
    }

    /**
     * Fails on event types without a handler.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    public ProjectionHandlers build() {
      if (handlers.isEmpty()) {
        throw new IllegalStateException("At least one handler must be registered");
      }
      return new ProjectionHandlers(this);
    }
  }
}
