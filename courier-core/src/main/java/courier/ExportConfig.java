package courier;

import courier.strategy.ExportStrategy;

public final class ExportConfig {
  private String exportStrategy = ExportStrategy.ALL.strategyName();

  public String getExportStrategy() {
    return exportStrategy;
  }

  /**
   * Sets the strategy by name ({@code all}, {@code firstSuccess}, {@code bestEffort}).
   * The name is resolved when an export runs, so an unknown name fails there.
   */
  public ExportConfig setExportStrategy(String exportStrategy) {
    this.exportStrategy = exportStrategy;
    return this;
  }

  public ExportConfig setExportStrategy(ExportStrategy exportStrategy) {
    this.exportStrategy = exportStrategy.strategyName();
    return this;
  }
}
