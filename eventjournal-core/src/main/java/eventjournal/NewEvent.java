package eventjournal;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An event that has been decided but not yet committed to a stream.
 *
 * <p>The journal assigns the stream id and version at append time and turns each
 * {@code NewEvent} into an {@link EventEnvelope}. The {@code eventId} defaults to a
 * time-ordered UUID; correlation and causation ids default to the event's own id,
 * which marks it as the root of a causal chain. Use {@link Builder#causedBy} to link
 * an event to the event that triggered it.
 *
 * @see EventEnvelope
 */
public final class NewEvent {
  private final String eventId;
  private final String type;
  private final byte[] payload;
  private final String correlationId;
  private final String causationId;
  private final Instant occurredAt;

  private NewEvent(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
    if (builder.payload == null) {
      throw new IllegalArgumentException("payload must be set");
    }
    if (builder.payload.length > EventEnvelope.MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of "
          + EventEnvelope.MAX_PAYLOAD_BYTES + " bytes");
    }
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
    this.correlationId = builder.correlationId == null ? eventId : builder.correlationId;
    this.causationId = builder.causationId == null ? eventId : builder.causationId;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
  }

  public static Builder builder(EventType type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type.name());
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  /**
   * Creates an event with a JSON payload and default metadata.
   *
   * @param type        the event type
   * @param payloadJson the JSON payload
   * @return a new event
   */
  public static NewEvent ofJson(EventType type, String payloadJson) {
    return builder(type).payloadJson(payloadJson).build();
  }

  public static NewEvent ofJson(String type, String payloadJson) {
    return builder(type).payloadJson(payloadJson).build();
  }

  public String eventId() {
    return eventId;
  }

  public String type() {
    return type;
  }

  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public String correlationId() {
    return correlationId;
  }

  public String causationId() {
    return causationId;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  /**
   * Binds this event to its committed position in a stream.
   *
   * @param streamId the stream the event was appended to
   * @param version  the stream version after this event
   * @return the committed envelope
   */
  public EventEnvelope toEnvelope(String streamId, long version) {
    return EventEnvelope.builder(type)
        .eventId(eventId)
        .streamId(streamId)
        .version(version)
        .payload(payload)
        .correlationId(correlationId)
        .causationId(causationId)
        .occurredAt(occurredAt)
        .build();
  }

  @Override
  public String toString() {
    return "NewEvent{eventId=" + eventId + ", type=" + type + '}';
  }

  static String newEventId() {
    return UlidCreator.getMonotonicUlid().toUuid().toString();
  }

  /** Builder for {@link NewEvent}. */
  public static final class Builder {
    private final String type;
    private String eventId;
    private byte[] payload;
    private String correlationId;
    private String causationId;
    private Instant occurredAt;

    private Builder(String type) {
      this.type = type;
    }

    /**
     * Sets a caller-chosen event id. Optional; defaults to a time-ordered UUID.
     *
     * @param eventId the event id
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the payload as a JSON string, stored as UTF-8 bytes.
     *
     * @param payloadJson the JSON payload
     * @return this builder
     */
    public Builder payloadJson(String payloadJson) {
      Objects.requireNonNull(payloadJson, "payloadJson");
      this.payload = payloadJson.getBytes(StandardCharsets.UTF_8);
      return this;
    }

    /**
     * Sets the payload as opaque bytes. The array is copied at build time.
     *
     * @param payload the raw payload
     * @return this builder
     */
    public Builder payload(byte[] payload) {
      this.payload = Objects.requireNonNull(payload, "payload");
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder causationId(String causationId) {
      this.causationId = causationId;
      return this;
    }

    /**
     * Links this event to the event that triggered it: the correlation id is
     * inherited and the causation id is the cause's event id.
     *
     * @param cause the triggering event
     * @return this builder
     */
    public Builder causedBy(EventEnvelope cause) {
      Objects.requireNonNull(cause, "cause");
      this.correlationId = cause.correlationId();
      this.causationId = cause.eventId();
      return this;
    }

    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    public NewEvent build() {
      return new NewEvent(this);
    }
  }
}
