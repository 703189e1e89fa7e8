package eventjournal.spi;

/**
 * Observability hook for exporting journal counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. The
 * {@code eventjournal-micrometer} module bridges this interface into Micrometer.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events committed by appends.
   *
   * @param count number of events in the committed batch
   */
  void incrementAppended(int count);

  /**
   * Increments the count of appends rejected by the optimistic version check.
   */
  void incrementAppendConflict();

  /**
   * Increments the count of commands that gave up after exhausting their attempts.
   */
  void incrementCommandExhausted();

  /**
   * Increments the count of storage operations retried after a transient failure.
   */
  default void incrementStorageRetry() {
  }

  /**
   * Increments the count of events applied by a projection.
   *
   * @param projectionName the projection (qualified with its version)
   */
  void incrementProjectionApplied(String projectionName);

  /**
   * Increments the count of events skipped as already applied.
   */
  default void incrementProjectionDuplicate(String projectionName) {
  }

  /**
   * Increments the count of events whose apply failed and quarantined their stream.
   */
  void incrementProjectionFailed(String projectionName);

  /**
   * Increments the count of events deferred behind a quarantined stream.
   */
  void incrementDeferred(String projectionName);

  void incrementRedriveSuccess(String projectionName);

  void incrementRedrivePartial(String projectionName);

  /**
   * Increments the count of snapshots written.
   */
  default void incrementSnapshotSaved() {
  }

  /**
   * Records the number of streams currently quarantined for a projection.
   */
  void recordQuarantined(String projectionName, int streams);

  /**
   * Records how far (in milliseconds) the journal tailer trails the newest event it saw.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  default void recordTailerLagMs(long lagMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementAppended(int count) {
    }

    @Override
    public void incrementAppendConflict() {
    }

    @Override
    public void incrementCommandExhausted() {
    }

    @Override
    public void incrementProjectionApplied(String projectionName) {
    }

    @Override
    public void incrementProjectionFailed(String projectionName) {
    }

    @Override
    public void incrementDeferred(String projectionName) {
    }

    @Override
    public void incrementRedriveSuccess(String projectionName) {
    }

    @Override
    public void incrementRedrivePartial(String projectionName) {
    }

    @Override
    public void recordQuarantined(String projectionName, int streams) {
    }
  }
}
