package courier;

import courier.model.OutcomeRecord;
import courier.registry.DestinationRegistry;
import courier.spi.ConnectionProvider;
import courier.spi.ExportMetrics;
import courier.spi.OutcomeStore;
import courier.spi.OutcomeStoreException;
import courier.strategy.ExportStrategy;
import courier.util.JsonCodec;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for exporting finished records to every enabled destination.
 *
 * <p>For each (file, session) pair a fresh {@link ExportContext} is built, the registry runs
 * the configured {@link ExportStrategy}, and every result is appended to the outcome log in
 * one transaction. Destination failures never escape; they come back as failed results.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExportOrchestrator orchestrator = ExportOrchestrator.builder()
 *     .registry(DefaultDestinationRegistry.builder().build())
 *     .config(new ExportConfig().setExportStrategy("bestEffort"))
 *     .outcomeStore(JdbcOutcomeStores.detect(dataSource))
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .build();
 *
 * Map<Path, List<ExportResult>> results = orchestrator.exportRecords(files, sessions);
 * }</pre>
 *
 * @see courier.registry.DestinationRegistry
 * @see courier.spi.OutcomeStore
 */
public final class ExportOrchestrator {
  private static final Logger logger = Logger.getLogger(ExportOrchestrator.class.getName());

  private final DestinationRegistry registry;
  private final ExportConfig config;
  private final OutcomeStore outcomeStore;
  private final ConnectionProvider connectionProvider;
  private final ExportMetrics metrics;
  private final JsonCodec jsonCodec;

  private ExportOrchestrator(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.config = builder.config == null ? new ExportConfig() : builder.config;
    this.outcomeStore = Objects.requireNonNull(builder.outcomeStore, "outcomeStore");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.metrics = builder.metrics == null ? ExportMetrics.NOOP : builder.metrics;
    this.jsonCodec = builder.jsonCodec == null ? JsonCodec.getDefault() : builder.jsonCodec;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Exports each file as the record of the session at the same index.
   *
   * @param files record files
   * @param sessions sessions, same length and order as {@code files}
   * @return results per file in input order; a file listed twice keeps its last results
   * @throws IllegalArgumentException if the lists differ in length (nothing is exported)
   * @throws courier.strategy.UnknownStrategyException if the configured strategy is unknown
   * (nothing is exported)
   * @throws OutcomeStoreException if writing the outcome log fails
   */
  public Map<Path, List<ExportResult>> exportRecords(List<Path> files, List<SessionDescriptor> sessions) {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(sessions, "sessions");
    if (files.size() != sessions.size()) {
      throw new IllegalArgumentException("files (" + files.size() + ") and sessions ("
          + sessions.size() + ") must have the same length");
    }
    ExportStrategy strategy = ExportStrategy.fromName(config.getExportStrategy());

    logger.log(Level.INFO, "Exporting {0} record(s) using strategy: {1}",
        new Object[]{files.size(), strategy.strategyName()});

    Map<Path, List<ExportResult>> results = new LinkedHashMap<>();
    for (int i = 0; i < files.size(); i++) {
      Path file = files.get(i);
      SessionDescriptor session = sessions.get(i);
      ExportContext context = ExportContext.of(file, session);

      logger.log(Level.INFO, "Exporting record: {0}", fileName(file));
      List<ExportResult> exportResults = List.copyOf(registry.exportToAll(context, strategy));
      results.put(file, exportResults);

      persist(session.sessionIdentifier(), exportResults);
      recordOutcome(file, strategy, exportResults);
    }
    return results;
  }

  /**
   * Returns whether at least one destination succeeded for the file.
   *
   * @param file record file
   * @param results output of {@link #exportRecords}
   * @return {@code false} if the file is absent or every result failed
   */
  public static boolean wasSuccessfullyExported(Path file, Map<Path, List<ExportResult>> results) {
    if (results == null) {
      return false;
    }
    List<ExportResult> fileResults = results.get(file);
    if (fileResults == null) {
      return false;
    }
    for (ExportResult result : fileResults) {
      if (result.success()) {
        return true;
      }
    }
    return false;
  }

  private void persist(String sessionIdentifier, List<ExportResult> exportResults) {
    if (exportResults.isEmpty()) {
      return;
    }
    List<OutcomeRecord> records = new ArrayList<>(exportResults.size());
    for (ExportResult result : exportResults) {
      records.add(OutcomeRecord.of(sessionIdentifier, result, jsonCodec.toJson(result.metadata())));
    }

    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        outcomeStore.insertBatch(conn, records);
        conn.commit();
      } catch (SQLException | RuntimeException ex) {
        rollbackQuietly(conn, ex);
        throw ex;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } catch (OutcomeStoreException ex) {
      throw ex;
    } catch (SQLException | RuntimeException ex) {
      throw new OutcomeStoreException("Failed to write outcome log for session " + sessionIdentifier, ex);
    }
  }

  private void recordOutcome(Path file, ExportStrategy strategy, List<ExportResult> exportResults) {
    long succeeded = exportResults.stream().filter(ExportResult::success).count();
    int total = exportResults.size();
    if (strategy.isSuccessful(exportResults)) {
      metrics.incrementRecordExported();
    } else {
      metrics.incrementRecordFailed();
    }
    if (succeeded > 0) {
      logger.log(Level.INFO, "Exported {0}: {1}/{2} destination(s) succeeded",
          new Object[]{fileName(file), succeeded, total});
    } else {
      logger.log(Level.SEVERE, "Export failed for {0}: all {1} destination(s) failed",
          new Object[]{fileName(file), total});
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException ex) {
      cause.addSuppressed(ex);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException ex) {
      logger.log(Level.FINE, "Failed to restore autoCommit", ex);
    }
  }

  private static String fileName(Path file) {
    Path name = file.getFileName();
    return name == null ? file.toString() : name.toString();
  }

  public static final class Builder {
    private DestinationRegistry registry;
    private ExportConfig config;
    private OutcomeStore outcomeStore;
    private ConnectionProvider connectionProvider;
    private ExportMetrics metrics;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    public Builder registry(DestinationRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder config(ExportConfig config) {
      this.config = config;
      return this;
    }

    public Builder outcomeStore(OutcomeStore outcomeStore) {
      this.outcomeStore = outcomeStore;
      return this;
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder metrics(ExportMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public ExportOrchestrator build() {
      return new ExportOrchestrator(this);
    }
  }
}
