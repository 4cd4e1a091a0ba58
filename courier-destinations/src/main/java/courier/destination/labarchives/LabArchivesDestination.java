package courier.destination.labarchives;

import courier.AbstractExportDestination;
import courier.DestinationSettings;
import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.ValidationResult;
import courier.destination.cdcs.CdcsDestination;
import courier.spi.DestinationProvider;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LabArchives electronic notebook destination.
 *
 * <p>Enabled when {@code labarchives.url} and {@code labarchives.api-key} are set. Runs
 * after CDCS (priority 90) so the notebook entry can link to the CDCS record. The notebook
 * API is not wired up yet, so every export returns a failed result carrying the CDCS link
 * it would have used.
 */
public class LabArchivesDestination extends AbstractExportDestination {
  private static final Logger logger = Logger.getLogger(LabArchivesDestination.class.getName());

  public static final String NAME = "labarchives";
  public static final int PRIORITY = 90;
  public static final String URL = "labarchives.url";
  public static final String API_KEY = "labarchives.api-key";

  static final String NOT_IMPLEMENTED = "LabArchives API integration not yet implemented";

  private final DestinationSettings settings;

  public LabArchivesDestination(DestinationSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return PRIORITY;
  }

  @Override
  public boolean enabled() {
    return settings.has(API_KEY) && settings.has(URL);
  }

  @Override
  public ValidationResult validateConfig() {
    if (!settings.has(API_KEY)) {
      return ValidationResult.invalid(API_KEY + " not configured");
    }
    if (!settings.has(URL)) {
      return ValidationResult.invalid(URL + " not configured");
    }
    return ValidationResult.ok();
  }

  @Override
  protected ExportResult doExport(ExportContext context) {
    ExportResult cdcs = context.result(CdcsDestination.NAME);
    String cdcsUrl = cdcs != null && cdcs.success() ? cdcs.recordUrl() : null;
    logger.log(Level.WARNING, "Skipping LabArchives export of {0}: {1}",
        new Object[]{context.sessionIdentifier(), NOT_IMPLEMENTED});
    return ExportResult.failed(NAME, NOT_IMPLEMENTED)
        .metadata("cdcs_url", cdcsUrl)
        .build();
  }

  /** Service-loader entry point. */
  public static final class Provider implements DestinationProvider {
    @Override
    public ExportDestination create(DestinationSettings settings) {
      return new LabArchivesDestination(settings);
    }
  }
}
