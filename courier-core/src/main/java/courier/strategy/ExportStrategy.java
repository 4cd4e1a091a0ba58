package courier.strategy;

import courier.ExportResult;

import java.util.List;
import java.util.Locale;

/**
 * How a batch of destinations is run for one record, and how its results are judged.
 */
public enum ExportStrategy {
  /** Run every destination; the record counts as exported only if all succeed. */
  ALL("all"),
  /** Run destinations in order and stop after the first success. */
  FIRST_SUCCESS("firstSuccess"),
  /** Run every destination; the record counts as exported if any succeeds. */
  BEST_EFFORT("bestEffort");

  private final String strategyName;

  ExportStrategy(String strategyName) {
    this.strategyName = strategyName;
  }

  /** Canonical configuration name. */
  public String strategyName() {
    return strategyName;
  }

  /**
   * Resolves a strategy by its configuration name. Accepts the canonical names and the
   * snake-case aliases {@code first_success} and {@code best_effort}.
   *
   * @param name strategy name
   * @return the strategy
   * @throws UnknownStrategyException if the name matches no strategy
   */
  public static ExportStrategy fromName(String name) {
    if (name == null) {
      throw new UnknownStrategyException(null);
    }
    String trimmed = name.trim();
    for (ExportStrategy strategy : values()) {
      if (strategy.strategyName.equals(trimmed)) {
        return strategy;
      }
    }
    switch (trimmed.toLowerCase(Locale.ROOT)) {
      case "first_success":
        return FIRST_SUCCESS;
      case "best_effort":
        return BEST_EFFORT;
      default:
        throw new UnknownStrategyException(name);
    }
  }

  /**
   * Interprets a batch of results under this strategy.
   *
   * @param results results produced for one record
   * @return {@code true} if the record counts as exported
   */
  public boolean isSuccessful(List<ExportResult> results) {
    if (results == null || results.isEmpty()) {
      return false;
    }
    if (this == ALL) {
      return results.stream().allMatch(ExportResult::success);
    }
    return results.stream().anyMatch(ExportResult::success);
  }
}
