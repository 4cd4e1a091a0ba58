package courier.registry;

import courier.DestinationSettings;
import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.spi.DestinationProvider;
import courier.spi.ExportMetrics;
import courier.strategy.ExportStrategy;
import courier.strategy.StrategyExecutor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry that discovers destinations through {@link ServiceLoader} and accepts explicit
 * registrations.
 *
 * <p>Discovery loads every {@link DestinationProvider} listed under
 * {@code META-INF/services/courier.spi.DestinationProvider} exactly once per registry. A
 * provider that cannot be loaded or whose {@code create} throws is logged and skipped.
 *
 * <p>Registering a name that is already present replaces the earlier destination and moves
 * it to the latest registration position.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DestinationRegistry registry = DefaultDestinationRegistry.builder()
 *     .settings(DestinationSettings.system())
 *     .build();
 *
 * DestinationRegistry manual = DefaultDestinationRegistry.builder()
 *     .discovery(false)
 *     .build()
 *     .register(new MyDestination());
 * }</pre>
 */
public final class DefaultDestinationRegistry implements DestinationRegistry {
  private static final Logger logger = Logger.getLogger(DefaultDestinationRegistry.class.getName());

  private static final Comparator<ExportDestination> BY_PRIORITY_DESC =
      Comparator.comparingInt(ExportDestination::priority).reversed();

  private final Map<String, ExportDestination> destinations = new LinkedHashMap<>();
  private final DestinationSettings settings;
  private final ClassLoader classLoader;
  private final StrategyExecutor executor;
  private final ExportMetrics metrics;
  private boolean discovered;

  private DefaultDestinationRegistry(Builder builder) {
    this.settings = builder.settings == null ? DestinationSettings.system() : builder.settings;
    this.classLoader = builder.classLoader;
    this.metrics = builder.metrics == null ? ExportMetrics.NOOP : builder.metrics;
    this.executor = new StrategyExecutor(metrics);
    this.discovered = !builder.discovery;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads destinations from all {@link DestinationProvider}s on the classpath.
   * Only the first call has an effect.
   */
  public synchronized void discover() {
    if (discovered) {
      return;
    }
    discovered = true;

    ServiceLoader<DestinationProvider> loader = classLoader == null
        ? ServiceLoader.load(DestinationProvider.class)
        : ServiceLoader.load(DestinationProvider.class, classLoader);
    Iterator<DestinationProvider> it = loader.iterator();
    int providers = 0;
    int added = 0;
    while (true) {
      DestinationProvider provider;
      try {
        if (!it.hasNext()) {
          break;
        }
        provider = it.next();
      } catch (ServiceConfigurationError ex) {
        logger.log(Level.SEVERE, "Failed to load destination provider, skipping", ex);
        continue;
      }
      providers++;
      ExportDestination destination;
      try {
        destination = provider.create(settings);
      } catch (RuntimeException ex) {
        logger.log(Level.SEVERE,
            "Destination provider " + provider.getClass().getName() + " failed, skipping", ex);
        continue;
      }
      try {
        add(destination);
        added++;
      } catch (IllegalArgumentException ex) {
        logger.log(Level.SEVERE, "Rejected destination from provider "
            + provider.getClass().getName() + ": " + ex.getMessage());
      }
    }

    if (providers == 0) {
      logger.warning("No destination providers found; no exports will be performed");
    } else {
      logger.log(Level.INFO, "Discovered {0} export destination(s): {1}",
          new Object[]{added, destinations.keySet()});
    }
  }

  /**
   * Registers a destination explicitly. Discovery runs first, so an explicit destination
   * replaces a discovered one with the same name.
   *
   * @param destination the destination
   * @return this registry for chaining
   * @throws IllegalArgumentException if the destination is null, its name is blank, or its
   * priority is outside {@code [MIN_PRIORITY, MAX_PRIORITY]}
   */
  public synchronized DefaultDestinationRegistry register(ExportDestination destination) {
    discover();
    add(destination);
    return this;
  }

  /**
   * Returns every registered destination, enabled or not, in registration order.
   */
  public synchronized List<ExportDestination> destinations() {
    discover();
    return List.copyOf(destinations.values());
  }

  @Override
  public synchronized List<ExportDestination> enabledDestinations() {
    discover();
    List<ExportDestination> enabled = new ArrayList<>();
    for (ExportDestination destination : destinations.values()) {
      if (isEnabled(destination)) {
        enabled.add(destination);
      }
    }
    // List.sort is stable, so equal priorities keep registration order
    enabled.sort(BY_PRIORITY_DESC);
    return enabled;
  }

  @Override
  public List<ExportResult> exportToAll(ExportContext context, ExportStrategy strategy) {
    Objects.requireNonNull(strategy, "strategy");
    List<ExportDestination> enabled = enabledDestinations();
    metrics.recordEnabledDestinations(enabled.size());
    return executor.execute(strategy, enabled, context);
  }

  private void add(ExportDestination destination) {
    if (destination == null) {
      throw new IllegalArgumentException("destination cannot be null");
    }
    String name = destination.name();
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("destination name cannot be blank: " + destination.getClass().getName());
    }
    int priority = destination.priority();
    if (priority < ExportDestination.MIN_PRIORITY || priority > ExportDestination.MAX_PRIORITY) {
      throw new IllegalArgumentException("destination " + name + " has priority " + priority
          + " outside [" + ExportDestination.MIN_PRIORITY + ", " + ExportDestination.MAX_PRIORITY + "]");
    }
    ExportDestination previous = destinations.remove(name);
    if (previous != null) {
      logger.log(Level.WARNING, "Destination name {0} registered twice; {1} replaces {2}",
          new Object[]{name, destination.getClass().getName(), previous.getClass().getName()});
    }
    destinations.put(name, destination);
    logger.log(Level.FINE, "Registered destination {0} (priority {1})", new Object[]{name, priority});
  }

  private static boolean isEnabled(ExportDestination destination) {
    try {
      return destination.enabled();
    } catch (RuntimeException ex) {
      logger.log(Level.SEVERE, "Destination " + destination.name() + " threw from enabled(), treating as disabled", ex);
      return false;
    }
  }

  public static final class Builder {
    private DestinationSettings settings;
    private ClassLoader classLoader;
    private ExportMetrics metrics;
    private boolean discovery = true;

    private Builder() {
    }

    /** Settings passed to providers; defaults to {@link DestinationSettings#system()}. */
    public Builder settings(DestinationSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder classLoader(ClassLoader classLoader) {
      this.classLoader = classLoader;
      return this;
    }

    public Builder metrics(ExportMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Whether {@link ServiceLoader} discovery runs. Defaults to {@code true}. */
    public Builder discovery(boolean discovery) {
      this.discovery = discovery;
      return this;
    }

    public DefaultDestinationRegistry build() {
      return new DefaultDestinationRegistry(this);
    }
  }
}
