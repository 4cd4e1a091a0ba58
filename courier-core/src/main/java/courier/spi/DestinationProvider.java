package courier.spi;

import courier.DestinationSettings;
import courier.ExportDestination;

/**
 * Contributes one {@link ExportDestination} to registry discovery.
 *
 * <p>Implementations are listed in {@code META-INF/services/courier.spi.DestinationProvider}
 * and need a public no-arg constructor. A provider that fails to load, or whose
 * {@link #create} throws, is logged and skipped.
 */
public interface DestinationProvider {

    /**
     * Creates the destination.
     *
     * @param settings configuration values for the destination
     * @return the destination (never {@code null})
     */
    ExportDestination create(DestinationSettings settings);
}
