package eventjournal.model;

import java.util.Objects;

/**
 * The version of the last event a projection durably applied for a stream.
 */
public record ProjectionCheckpoint(String projectionName, String streamId, long lastAppliedVersion) {

  public ProjectionCheckpoint {
    Objects.requireNonNull(projectionName, "projectionName");
    Objects.requireNonNull(streamId, "streamId");
    if (lastAppliedVersion < 0) {
      throw new IllegalArgumentException("lastAppliedVersion must be >= 0");
    }
  }
}
