package courier.preflight;

import courier.ExportDestination;
import courier.ValidationResult;
import courier.registry.DestinationRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Checks, before a batch run, that at least one destination is enabled and that every
 * enabled destination passes {@link ExportDestination#validateConfig()}.
 *
 * <p>Never called by the orchestrator. Failures are advisory: a validation may fail on a
 * transient network error that would not affect the real export.
 */
public final class DestinationPreflight {
  private static final Logger logger = Logger.getLogger(DestinationPreflight.class.getName());

  public static final String CHECK_NAME = "export_destinations";

  private DestinationPreflight() {
  }

  public static PreflightResult check(DestinationRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    List<ExportDestination> enabled;
    try {
      enabled = registry.enabledDestinations();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "Destination discovery failed during preflight", ex);
      return new PreflightResult(CHECK_NAME, false, "Could not discover export destinations: " + ex.getMessage());
    }

    if (enabled.isEmpty()) {
      return new PreflightResult(CHECK_NAME, false,
          "No export destinations are enabled. Built records will not be uploaded anywhere. "
              + "Configure at least one destination (e.g., courier.cdcs.url and courier.cdcs.token for CDCS).");
    }

    List<String> failures = new ArrayList<>();
    for (ExportDestination destination : enabled) {
      ValidationResult validation;
      try {
        validation = destination.validateConfig();
      } catch (RuntimeException ex) {
        failures.add(destination.name() + ": unexpected error: " + ex.getMessage());
        continue;
      }
      if (validation == null || !validation.valid()) {
        failures.add(destination.name() + ": " + (validation == null ? "no validation result" : validation.error()));
      }
    }

    if (!failures.isEmpty()) {
      String message = "Some export destinations have configuration issues "
          + "(transient network errors may be ignored): " + String.join("; ", failures);
      logger.warning(message);
      return new PreflightResult(CHECK_NAME, false, message);
    }

    String names = enabled.stream().map(ExportDestination::name).collect(Collectors.joining(", "));
    return new PreflightResult(CHECK_NAME, true, "Export destination(s) OK: " + names + ".");
  }
}
