package courier;

/**
 * A repository that finished records can be exported to.
 *
 * <p>Implementations must never let {@link #export(ExportContext)} throw; every failure is
 * reported as a failed {@link ExportResult}. Extending {@link AbstractExportDestination}
 * guarantees that.
 *
 * @see AbstractExportDestination
 * @see courier.spi.DestinationProvider
 */
public interface ExportDestination {

    /** Lowest allowed priority. */
    int MIN_PRIORITY = 0;

    /** Highest allowed priority. */
    int MAX_PRIORITY = 1000;

    /**
     * Stable, unique identifier. Used as the key in {@link ExportContext#previousResults()}
     * and in the outcome log.
     */
    String name();

    /**
     * Execution order hint in {@code [MIN_PRIORITY, MAX_PRIORITY]}; higher runs first.
     */
    int priority();

    /**
     * Whether the destination is configured and should take part in exports.
     * Re-evaluated on every call.
     */
    boolean enabled();

    /**
     * Checks configuration in depth, possibly contacting the remote service.
     *
     * @return the validation outcome (never {@code null})
     */
    ValidationResult validateConfig();

    /**
     * Exports one record.
     *
     * @param context the shared export context, including earlier destinations' results
     * @return the outcome (never {@code null}); failures are returned, not thrown
     */
    ExportResult export(ExportContext context);
}
