package eventjournal.micrometer;

import eventjournal.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code journal.append.events}: events committed</li>
 *   <li>{@code journal.append.conflicts}: appends rejected by the version check</li>
 *   <li>{@code journal.command.exhausted}: commands that ran out of attempts</li>
 *   <li>{@code journal.storage.retries}: storage operations retried</li>
 *   <li>{@code journal.snapshot.saved}: snapshots written</li>
 *   <li>{@code journal.projection.applied}, {@code .duplicates}, {@code .failed},
 *       {@code .deferred}: per projection, tagged {@code projection}</li>
 *   <li>{@code journal.redrive.success}, {@code journal.redrive.partial}: per projection</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code journal.projection.quarantined}: quarantined streams, per projection</li>
 *   <li>{@code journal.tailer.lag.ms}: age of the newest event seen by the tailer</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String PROJECTION_TAG = "projection";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter appended;
  private final Counter appendConflicts;
  private final Counter commandExhausted;
  private final Counter storageRetries;
  private final Counter snapshotsSaved;
  private final Gauge tailerLagGauge;
  private final AtomicLong tailerLagMs = new AtomicLong();

  private final Map<String, Counter> projectionCounters = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> quarantined = new ConcurrentHashMap<>();
  private final List<Meter> dynamicMeters = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "journal"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "journal");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.journal"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.appended = Counter.builder(namePrefix + ".append.events")
        .description("Events committed to the journal")
        .register(registry);
    this.appendConflicts = Counter.builder(namePrefix + ".append.conflicts")
        .description("Appends rejected by the optimistic version check")
        .register(registry);
    this.commandExhausted = Counter.builder(namePrefix + ".command.exhausted")
        .description("Commands that gave up after exhausting their attempts")
        .register(registry);
    this.storageRetries = Counter.builder(namePrefix + ".storage.retries")
        .description("Storage operations retried after a transient failure")
        .register(registry);
    this.snapshotsSaved = Counter.builder(namePrefix + ".snapshot.saved")
        .description("Aggregate snapshots written")
        .register(registry);
    this.tailerLagGauge = Gauge.builder(namePrefix + ".tailer.lag.ms", tailerLagMs, AtomicLong::get)
        .description("Age of the newest event seen by the journal tailer")
        .register(registry);
  }

  @Override
  public void incrementAppended(int count) {
    if (closed) return;
    appended.increment(count);
  }

  @Override
  public void incrementAppendConflict() {
    if (closed) return;
    appendConflicts.increment();
  }

  @Override
  public void incrementCommandExhausted() {
    if (closed) return;
    commandExhausted.increment();
  }

  @Override
  public void incrementStorageRetry() {
    if (closed) return;
    storageRetries.increment();
  }

  @Override
  public void incrementProjectionApplied(String projectionName) {
    increment("projection.applied", "Events applied by the projection", projectionName);
  }

  @Override
  public void incrementProjectionDuplicate(String projectionName) {
    increment("projection.duplicates", "Events skipped as already applied", projectionName);
  }

  @Override
  public void incrementProjectionFailed(String projectionName) {
    increment("projection.failed", "Events whose apply failed and quarantined the stream", projectionName);
  }

  @Override
  public void incrementDeferred(String projectionName) {
    increment("projection.deferred", "Events deferred behind a quarantined stream", projectionName);
  }

  @Override
  public void incrementRedriveSuccess(String projectionName) {
    increment("redrive.success", "Redrives that released their stream", projectionName);
  }

  @Override
  public void incrementRedrivePartial(String projectionName) {
    increment("redrive.partial", "Redrives that stopped at a failing event", projectionName);
  }

  @Override
  public void incrementSnapshotSaved() {
    if (closed) return;
    snapshotsSaved.increment();
  }

  @Override
  public void recordQuarantined(String projectionName, int streams) {
    if (closed) return;
    quarantined.computeIfAbsent(projectionName, name -> {
      AtomicInteger value = new AtomicInteger();
      dynamicMeters.add(Gauge.builder(namePrefix + ".projection.quarantined", value, AtomicInteger::get)
          .description("Streams currently quarantined")
          .tag(PROJECTION_TAG, name)
          .register(registry));
      return value;
    }).set(streams);
  }

  @Override
  public void recordTailerLagMs(long lagMs) {
    if (closed) return;
    tailerLagMs.set(lagMs);
  }

  private void increment(String name, String description, String projectionName) {
    if (closed) return;
    projectionCounters.computeIfAbsent(name + '/' + projectionName, key -> {
      Counter counter = Counter.builder(namePrefix + '.' + name)
          .description(description)
          .tag(PROJECTION_TAG, projectionName)
          .register(registry);
      dynamicMeters.add(counter);
      return counter;
    }).increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link eventjournal.Journal} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(appended, appendConflicts, commandExhausted,
        storageRetries, snapshotsSaved, tailerLagGauge));
    meters.addAll(dynamicMeters);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
