package eventjournal;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable committed event: the storage and exchange format that producers and
 * consumers of the journal agree on.
 *
 * <p>Ordering is defined per stream by {@link #version()}; there is no global order
 * across streams. The payload is opaque; {@link #payloadJson()} decodes it as UTF-8
 * for the common JSON case. When the payload has been crypto-shredded
 * ({@link #payloadErased()}), the payload is empty but every ordering field is intact.
 *
 * @see NewEvent
 */
public final class EventEnvelope {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

  private final String eventId;
  private final String streamId;
  private final long version;
  private final String type;
  private final byte[] payload;
  private final String correlationId;
  private final String causationId;
  private final Instant occurredAt;
  private final boolean payloadErased;

  private EventEnvelope(Builder builder) {
    this.eventId = Objects.requireNonNull(builder.eventId, "eventId");
    this.streamId = Objects.requireNonNull(builder.streamId, "streamId");
    this.type = Objects.requireNonNull(builder.type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
    if (builder.version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + builder.version);
    }
    this.version = builder.version;
    byte[] bytes = builder.payload == null ? new byte[0] : builder.payload;
    if (bytes.length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    this.payload = Arrays.copyOf(bytes, bytes.length);
    this.correlationId = builder.correlationId;
    this.causationId = builder.causationId;
    this.occurredAt = Objects.requireNonNull(builder.occurredAt, "occurredAt");
    this.payloadErased = builder.payloadErased;
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public String eventId() {
    return eventId;
  }

  public String streamId() {
    return streamId;
  }

  /**
   * Returns the stream version after this event was committed (1-based).
   *
   * @return the event's version within its stream
   */
  public long version() {
    return version;
  }

  public String type() {
    return type;
  }

  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public String payloadJson() {
    return new String(payload, StandardCharsets.UTF_8);
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

  public boolean payloadErased() {
    return payloadErased;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventEnvelope that)) return false;
    return version == that.version
        && payloadErased == that.payloadErased
        && eventId.equals(that.eventId)
        && streamId.equals(that.streamId)
        && type.equals(that.type)
        && Arrays.equals(payload, that.payload)
        && Objects.equals(correlationId, that.correlationId)
        && Objects.equals(causationId, that.causationId)
        && occurredAt.equals(that.occurredAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventId, streamId, version);
  }

  @Override
  public String toString() {
    return "EventEnvelope{eventId=" + eventId
        + ", streamId=" + streamId
        + ", version=" + version
        + ", type=" + type + '}';
  }

  /** Builder for {@link EventEnvelope}. */
  public static final class Builder {
    private final String type;
    private String eventId;
    private String streamId;
    private long version;
    private byte[] payload;
    private String correlationId;
    private String causationId;
    private Instant occurredAt;
    private boolean payloadErased;

    private Builder(String type) {
      this.type = type;
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder streamId(String streamId) {
      this.streamId = streamId;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    public Builder payloadJson(String payloadJson) {
      this.payload = payloadJson == null ? null : payloadJson.getBytes(StandardCharsets.UTF_8);
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

    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    public Builder payloadErased(boolean payloadErased) {
      this.payloadErased = payloadErased;
      return this;
    }

    /**
     * Builds an immutable envelope.
     *
     * @return the envelope
     * @throws NullPointerException     if eventId, streamId, type or occurredAt is missing
     * @throws IllegalArgumentException if version is below 1, type is empty, or the
     *                                  payload exceeds {@value EventEnvelope#MAX_PAYLOAD_BYTES} bytes
     */
    public EventEnvelope build() {
      return new EventEnvelope(this);
    }
  }
}
