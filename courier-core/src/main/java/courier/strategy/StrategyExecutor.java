package courier.strategy;

import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.spi.ExportMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an ordered list of destinations for one record under an {@link ExportStrategy}.
 *
 * <p>Destinations run sequentially in the given order. Each result is added to the
 * {@link ExportContext} before the next destination is called. A destination that throws
 * or returns {@code null} breaks its contract; the executor logs it and records a failed
 * result in its place.
 */
public final class StrategyExecutor {
  private static final Logger logger = Logger.getLogger(StrategyExecutor.class.getName());

  private final ExportMetrics metrics;

  public StrategyExecutor() {
    this(ExportMetrics.NOOP);
  }

  public StrategyExecutor(ExportMetrics metrics) {
    this.metrics = metrics == null ? ExportMetrics.NOOP : metrics;
  }

  /**
   * Resolves the strategy by name, then executes it.
   *
   * @throws UnknownStrategyException before any destination runs if the name is unknown
   */
  public List<ExportResult> execute(String strategyName, List<? extends ExportDestination> destinations,
      ExportContext context) {
    return execute(ExportStrategy.fromName(strategyName), destinations, context);
  }

  /**
   * Executes the strategy.
   *
   * @param strategy the strategy
   * @param destinations destinations in execution order
   * @param context the context for this record
   * @return results in call order; shorter than {@code destinations} only for
   * {@link ExportStrategy#FIRST_SUCCESS}
   */
  public List<ExportResult> execute(ExportStrategy strategy, List<? extends ExportDestination> destinations,
      ExportContext context) {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(destinations, "destinations");
    Objects.requireNonNull(context, "context");

    List<ExportResult> results = new ArrayList<>(destinations.size());
    for (ExportDestination destination : destinations) {
      ExportResult result = invoke(destination, context);
      context.addResult(destination.name(), result);
      results.add(result);
      if (strategy == ExportStrategy.FIRST_SUCCESS && result.success()) {
        logger.log(Level.INFO, "Export to {0} succeeded, skipping remaining destinations",
            destination.name());
        break;
      }
    }
    logSummary(strategy, results, context);
    return results;
  }

  private ExportResult invoke(ExportDestination destination, ExportContext context) {
    String name = destination.name();
    logger.log(Level.INFO, "Exporting session {0} to {1}",
        new Object[]{context.sessionIdentifier(), name});
    long start = System.nanoTime();
    ExportResult result;
    try {
      result = destination.export(context);
      if (result == null) {
        logger.log(Level.SEVERE, "Destination {0} returned null from export()", name);
        result = ExportResult.failure(name, "Destination returned no result");
      }
    } catch (RuntimeException | LinkageError ex) {
      logger.log(Level.SEVERE, "Destination " + name + " threw from export()", ex);
      String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      result = ExportResult.failure(name, "Unexpected error: " + message);
    }
    long durationMs = (System.nanoTime() - start) / 1_000_000L;
    metrics.recordExportDurationMs(name, durationMs);

    if (result.success()) {
      metrics.incrementExportSuccess(name);
      logger.log(Level.INFO, "Exported session {0} to {1}: {2}",
          new Object[]{context.sessionIdentifier(), name, result.recordUrl()});
    } else {
      metrics.incrementExportFailure(name);
      logger.log(Level.WARNING, "Export of session {0} to {1} failed: {2}",
          new Object[]{context.sessionIdentifier(), name, result.errorMessage()});
    }
    return result;
  }

  private static void logSummary(ExportStrategy strategy, List<ExportResult> results, ExportContext context) {
    if (results.isEmpty()) {
      logger.log(Level.WARNING, "No enabled destinations for session {0}", context.sessionIdentifier());
      return;
    }
    long succeeded = results.stream().filter(ExportResult::success).count();
    if (strategy.isSuccessful(results)) {
      logger.log(Level.INFO, "Strategy {0} met for session {1}: {2}/{3} succeeded",
          new Object[]{strategy.strategyName(), context.sessionIdentifier(), succeeded, results.size()});
    } else {
      logger.log(Level.WARNING, "Strategy {0} not met for session {1}: {2}/{3} succeeded",
          new Object[]{strategy.strategyName(), context.sessionIdentifier(), succeeded, results.size()});
    }
  }
}
