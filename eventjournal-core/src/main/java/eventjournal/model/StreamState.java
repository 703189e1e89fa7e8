package eventjournal.model;

/**
 * Per-stream state of a projection with respect to its dead-letter queue.
 */
public enum StreamState {
  /** Events are applied as they arrive. */
  FLOWING,
  /** A failure is pending; later events of the stream are deferred, not applied. */
  QUARANTINED
}
