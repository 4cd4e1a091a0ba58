package courier;

/**
 * Outcome of {@link ExportDestination#validateConfig()}.
 *
 * @param valid whether the configuration is usable
 * @param error reason when invalid, otherwise {@code null}
 */
public record ValidationResult(boolean valid, String error) {

  private static final ValidationResult OK = new ValidationResult(true, null);

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult invalid(String error) {
    return new ValidationResult(false, error == null ? "invalid configuration" : error);
  }
}
