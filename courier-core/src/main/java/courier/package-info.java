/**
 * Core export API: destinations, results, the per-record context and the orchestrator.
 *
 * <p>Start with {@link courier.ExportOrchestrator} for batch exports, or implement
 * {@link courier.AbstractExportDestination} plus a {@link courier.spi.DestinationProvider}
 * to add a destination.
 */
package courier;
