package courier.micrometer;

import courier.spi.ExportMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link ExportMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code courier.export.success} (tag {@code destination}) - successful destination exports</li>
 *   <li>{@code courier.export.failure} (tag {@code destination}) - failed destination exports</li>
 *   <li>{@code courier.record.exported} - records whose results satisfied the strategy</li>
 *   <li>{@code courier.record.failed} - records whose results did not</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code courier.export.duration} (tag {@code destination}) - time spent in one destination</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code courier.destinations.enabled} - destinations enabled for the latest export</li>
 * </ul>
 *
 * @see ExportMetrics
 */
public final class MicrometerExportMetrics implements ExportMetrics, AutoCloseable {
  static final String DESTINATION_TAG = "destination";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter recordExported;
  private final Counter recordFailed;
  private final Gauge enabledGauge;
  private final AtomicInteger enabledDestinations = new AtomicInteger();

  private final Map<String, Counter> successByDestination = new ConcurrentHashMap<>();
  private final Map<String, Counter> failureByDestination = new ConcurrentHashMap<>();
  private final Map<String, Timer> durationByDestination = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "courier"}.
   */
  public MicrometerExportMetrics(MeterRegistry registry) {
    this(registry, "courier");
  }

  /**
   * Creates metrics with a custom name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "lims.courier"})
   */
  public MicrometerExportMetrics(MeterRegistry registry, String namePrefix) {
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
    this.recordExported = Counter.builder(namePrefix + ".record.exported")
        .description("Records whose export satisfied the strategy")
        .register(registry);
    this.recordFailed = Counter.builder(namePrefix + ".record.failed")
        .description("Records whose export did not satisfy the strategy")
        .register(registry);
    this.enabledGauge = Gauge.builder(namePrefix + ".destinations.enabled", enabledDestinations, AtomicInteger::get)
        .description("Destinations enabled for the latest export")
        .register(registry);
  }

  @Override
  public void incrementExportSuccess(String destinationName) {
    if (closed) return;
    successByDestination.computeIfAbsent(destinationName, name -> counter(".export.success", name,
        "Successful destination exports")).increment();
  }

  @Override
  public void incrementExportFailure(String destinationName) {
    if (closed) return;
    failureByDestination.computeIfAbsent(destinationName, name -> counter(".export.failure", name,
        "Failed destination exports")).increment();
  }

  @Override
  public void recordExportDurationMs(String destinationName, long durationMs) {
    if (closed) return;
    durationByDestination.computeIfAbsent(destinationName, name -> Timer.builder(namePrefix + ".export.duration")
        .description("Time spent exporting to one destination")
        .tag(DESTINATION_TAG, name)
        .register(registry)).record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementRecordExported() {
    if (closed) return;
    recordExported.increment();
  }

  @Override
  public void incrementRecordFailed() {
    if (closed) return;
    recordFailed.increment();
  }

  @Override
  public void recordEnabledDestinations(int count) {
    if (closed) return;
    enabledDestinations.set(count);
  }

  private Counter counter(String suffix, String destinationName, String description) {
    return Counter.builder(namePrefix + suffix)
        .description(description)
        .tag(DESTINATION_TAG, destinationName)
        .register(registry);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(recordExported, recordFailed, enabledGauge));
    meters.addAll(successByDestination.values());
    meters.addAll(failureByDestination.values());
    meters.addAll(durationByDestination.values());
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
