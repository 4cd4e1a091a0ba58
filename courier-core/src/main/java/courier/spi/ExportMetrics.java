package courier.spi;

/**
 * Observability hook for export counters and timings.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code courier-micrometer} bridges it
 * to a Micrometer registry.
 */
public interface ExportMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    ExportMetrics NOOP = new Noop();

    /**
     * Counts a successful export to one destination.
     */
    void incrementExportSuccess(String destinationName);

    /**
     * Counts a failed export to one destination.
     */
    void incrementExportFailure(String destinationName);

    /**
     * Records how long one destination's export took.
     *
     * @param destinationName destination name
     * @param durationMs duration in milliseconds
     */
    default void recordExportDurationMs(String destinationName, long durationMs) {
    }

    /**
     * Counts a record whose results satisfied the configured strategy.
     */
    void incrementRecordExported();

    /**
     * Counts a record whose results did not satisfy the configured strategy.
     */
    void incrementRecordFailed();

    /**
     * Records the number of destinations enabled for the latest export.
     */
    default void recordEnabledDestinations(int count) {
    }

    final class Noop implements ExportMetrics {
        @Override
        public void incrementExportSuccess(String destinationName) {
        }

        @Override
        public void incrementExportFailure(String destinationName) {
        }

        @Override
        public void incrementRecordExported() {
        }

        @Override
        public void incrementRecordFailed() {
        }
    }
}
