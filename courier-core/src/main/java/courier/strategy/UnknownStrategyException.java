package courier.strategy;

/**
 * Thrown when a strategy name matches no {@link ExportStrategy}.
 */
public class UnknownStrategyException extends IllegalArgumentException {
  private final String strategyName;

  public UnknownStrategyException(String strategyName) {
    super("Unknown export strategy: " + strategyName
        + " (expected one of: all, firstSuccess, bestEffort)");
    this.strategyName = strategyName;
  }

  public String strategyName() {
    return strategyName;
  }
}
