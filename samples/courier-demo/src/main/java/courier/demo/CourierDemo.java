package courier.demo;

import courier.AbstractExportDestination;
import courier.ExportConfig;
import courier.ExportContext;
import courier.ExportOrchestrator;
import courier.ExportResult;
import courier.SessionDescriptor;
import courier.ValidationResult;
import courier.jdbc.DataSourceConnectionProvider;
import courier.jdbc.store.AbstractJdbcOutcomeStore;
import courier.jdbc.store.JdbcOutcomeStores;
import courier.model.OutcomeRecord;
import courier.preflight.DestinationPreflight;
import courier.preflight.PreflightResult;
import courier.registry.DefaultDestinationRegistry;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Exports two records to two in-process destinations and prints the outcome log.
 *
 * Run with: mvn -pl samples/courier-demo exec:java
 */
public final class CourierDemo {

  public static void main(String[] args) throws Exception {
    // 1. Setup H2 in-memory database with the outcome table
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:courier_demo;DB_CLOSE_DELAY=-1");
    createSchema(dataSource);

    // 2. Register destinations; discovery is off so only these two run
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .discovery(false)
        .build()
        .register(new RepositoryDestination())
        .register(new NotebookDestination());

    PreflightResult preflight = DestinationPreflight.check(registry);
    System.out.println("[Preflight] " + preflight.message() + "\n");

    // 3. Build the orchestrator
    AbstractJdbcOutcomeStore store = JdbcOutcomeStores.detect(dataSource);
    ExportOrchestrator orchestrator = ExportOrchestrator.builder()
        .registry(registry)
        .config(new ExportConfig().setExportStrategy("bestEffort"))
        .outcomeStore(store)
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .build();

    // 4. Export two records
    Instant start = Instant.parse("2024-03-01T09:00:00Z");
    List<Path> files = List.of(Path.of("records", "titan-0301.xml"), Path.of("records", "quanta-0301.xml"));
    List<SessionDescriptor> sessions = List.of(
        new SessionDescriptor("session-1", "FEI-Titan-TEM", start, start.plusSeconds(3600), "alice"),
        new SessionDescriptor("session-2", "FEI-Quanta-SEM", start, start.plusSeconds(5400), null));

    System.out.println("=== Courier Demo ===\n");
    Map<Path, List<ExportResult>> results = orchestrator.exportRecords(files, sessions);
    for (Path file : files) {
      System.out.println(file.getFileName() + " exported: "
          + ExportOrchestrator.wasSuccessfullyExported(file, results));
    }

    // 5. Show the outcome log
    System.out.println("\n=== Outcome Log ===");
    System.out.printf("%-10s | %-12s | %-7s | %s%n", "SESSION", "DESTINATION", "SUCCESS", "DETAIL");
    System.out.println("-".repeat(80));
    try (Connection conn = dataSource.getConnection()) {
      for (SessionDescriptor session : sessions) {
        for (OutcomeRecord row : store.findBySession(conn, session.sessionIdentifier())) {
          System.out.printf("%-10s | %-12s | %-7s | %s%n",
              row.sessionIdentifier(),
              row.destinationName(),
              row.success(),
              row.success() ? row.recordUrl() : row.errorMessage());
        }
      }
    }

    System.out.println("\nDemo complete.");
  }

  private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
    String ddl;
    try (InputStream in = CourierDemo.class.getClassLoader().getResourceAsStream("schema/h2.sql")) {
      if (in == null) {
        throw new IllegalStateException("schema/h2.sql not found on classpath");
      }
      ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql);
        }
      }
    }
  }

  /** Always succeeds; later destinations can link to its records. */
  static final class RepositoryDestination extends AbstractExportDestination {
    @Override
    public String name() {
      return "repository";
    }

    @Override
    public int priority() {
      return 100;
    }

    @Override
    public boolean enabled() {
      return true;
    }

    @Override
    public ValidationResult validateConfig() {
      return ValidationResult.ok();
    }

    @Override
    protected ExportResult doExport(ExportContext context) {
      String id = "rec-" + context.sessionIdentifier();
      return ExportResult.success(name(), id, "https://repository.example.org/data?id=" + id);
    }
  }

  /** Fails for sessions without a user, otherwise links back to the repository record. */
  static final class NotebookDestination extends AbstractExportDestination {
    @Override
    public String name() {
      return "notebook";
    }

    @Override
    public int priority() {
      return 50;
    }

    @Override
    public boolean enabled() {
      return true;
    }

    @Override
    public ValidationResult validateConfig() {
      return ValidationResult.ok();
    }

    @Override
    protected ExportResult doExport(ExportContext context) {
      if (context.user() == null) {
        throw new IllegalStateException("No notebook owner for " + context.sessionIdentifier());
      }
      ExportResult repository = context.result("repository");
      return ExportResult.succeeded(name())
          .recordId("entry-" + context.sessionIdentifier())
          .metadata("repository_url", repository == null ? null : repository.recordUrl())
          .build();
    }
  }
}
