package courier.registry;

import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.strategy.ExportStrategy;

import java.util.List;

/**
 * Holds the known export destinations and runs them for a record.
 *
 * @see DefaultDestinationRegistry
 */
public interface DestinationRegistry {

  /**
   * Returns the enabled destinations, highest priority first. Destinations with equal
   * priority keep their registration order.
   */
  List<ExportDestination> enabledDestinations();

  /**
   * Exports one record to every enabled destination under the given strategy.
   *
   * @param context the context for this record
   * @param strategy the strategy
   * @return results in call order
   */
  List<ExportResult> exportToAll(ExportContext context, ExportStrategy strategy);

  /**
   * Resolves the strategy by name, then exports.
   *
   * @throws courier.strategy.UnknownStrategyException if the name is unknown
   */
  default List<ExportResult> exportToAll(ExportContext context, String strategyName) {
    return exportToAll(context, ExportStrategy.fromName(strategyName));
  }
}
