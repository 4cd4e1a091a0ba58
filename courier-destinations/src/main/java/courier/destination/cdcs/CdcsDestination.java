package courier.destination.cdcs;

import courier.AbstractExportDestination;
import courier.DestinationSettings;
import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.ValidationResult;
import courier.destination.http.HttpClients;
import courier.spi.DestinationProvider;
import okhttp3.OkHttpClient;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uploads the XML record to a CDCS instance and assigns it to the token's workspace.
 *
 * <p>Enabled when {@code cdcs.url} and {@code cdcs.token} are set. Runs first (priority
 * 100) so later destinations can link to the CDCS record.
 */
public class CdcsDestination extends AbstractExportDestination {
  private static final Logger logger = Logger.getLogger(CdcsDestination.class.getName());

  public static final String NAME = "cdcs";
  public static final int PRIORITY = 100;
  public static final String URL = "cdcs.url";
  public static final String TOKEN = "cdcs.token";

  private final DestinationSettings settings;
  private final OkHttpClient httpClient;

  public CdcsDestination(DestinationSettings settings) {
    this(settings, HttpClients.defaultClient());
  }

  public CdcsDestination(DestinationSettings settings, OkHttpClient httpClient) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
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
    return settings.has(URL) && settings.has(TOKEN);
  }

  @Override
  public ValidationResult validateConfig() {
    if (!settings.has(TOKEN)) {
      return ValidationResult.invalid(TOKEN + " not configured");
    }
    if (!settings.has(URL)) {
      return ValidationResult.invalid(URL + " not configured");
    }
    try {
      client().workspaceId();
    } catch (CdcsAuthenticationException ex) {
      return ValidationResult.invalid("CDCS authentication failed: " + ex.getMessage());
    } catch (Exception ex) {
      return ValidationResult.invalid("CDCS configuration error: " + ex.getMessage());
    }
    return ValidationResult.ok();
  }

  @Override
  protected ExportResult doExport(ExportContext context) throws Exception {
    Path file = context.filePath();
    String xml = Files.readString(file, StandardCharsets.UTF_8);
    String title = stem(file);

    CdcsClient client = client();
    String recordId = client.createRecord(title, xml);
    client.assignToWorkspace(recordId, client.workspaceId());
    String recordUrl = client.recordUrl(recordId);
    logger.log(Level.INFO, "Record \"{0}\" available at {1}", new Object[]{title, recordUrl});

    return ExportResult.success(NAME, recordId, recordUrl);
  }

  CdcsClient client() {
    return new CdcsClient(settings.get(URL), settings.get(TOKEN), httpClient);
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /** Service-loader entry point. */
  public static final class Provider implements DestinationProvider {
    @Override
    public ExportDestination create(DestinationSettings settings) {
      return new CdcsDestination(settings);
    }
  }
}
