package courier;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for destinations that turns every exception into a failed result.
 *
 * <p>Subclasses implement {@link #doExport(ExportContext)} and may throw freely; the final
 * {@link #export(ExportContext)} converts the throw into
 * {@link ExportResult#failure(String, String)} so nothing escapes to the executor.
 */
public abstract class AbstractExportDestination implements ExportDestination {
  private static final Logger logger = Logger.getLogger(AbstractExportDestination.class.getName());

  @Override
  public final ExportResult export(ExportContext context) {
    try {
      ExportResult result = doExport(context);
      if (result == null) {
        return ExportResult.failure(name(), "Destination returned no result");
      }
      return result;
    } catch (Exception ex) {
      logger.log(Level.WARNING, "Export to " + name() + " failed", ex);
      return ExportResult.failure(name(), describe(ex));
    }
  }

  /**
   * Performs the export.
   *
   * @param context the shared export context
   * @return the outcome; a {@code null} return is reported as a failure
   * @throws Exception any failure, converted into a failed result by the caller
   */
  protected abstract ExportResult doExport(ExportContext context) throws Exception;

  /**
   * Builds the error message stored for an exception. Defaults to the exception message,
   * falling back to the class name.
   */
  protected String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }

  /** Trims a value and maps blank to {@code null}. */
  protected static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name() + ", priority=" + priority() + '}';
  }
}
