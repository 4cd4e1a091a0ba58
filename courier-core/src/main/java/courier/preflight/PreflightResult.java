package courier.preflight;

/**
 * Outcome of a preflight check.
 *
 * @param name check name
 * @param passed whether the check passed
 * @param message human-readable detail
 */
public record PreflightResult(String name, boolean passed, String message) {
}
