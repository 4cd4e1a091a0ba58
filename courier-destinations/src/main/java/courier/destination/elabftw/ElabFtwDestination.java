package courier.destination.elabftw;

import courier.AbstractExportDestination;
import courier.DestinationSettings;
import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.ValidationResult;
import courier.destination.cdcs.CdcsDestination;
import courier.destination.http.HttpClients;
import courier.spi.DestinationProvider;
import okhttp3.OkHttpClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates an eLabFTW experiment summarising the session and attaches the XML record.
 *
 * <p>Enabled when {@code elabftw.url} and {@code elabftw.api-key} are set. When CDCS
 * exported the record earlier in the same run, the CDCS URL is linked from the experiment
 * body, stored in the experiment metadata and returned in the result metadata as
 * {@code cdcs_url}.
 */
public class ElabFtwDestination extends AbstractExportDestination {
  private static final Logger logger = Logger.getLogger(ElabFtwDestination.class.getName());

  public static final String NAME = "elabftw";
  public static final int PRIORITY = 85;
  public static final String URL = "elabftw.url";
  public static final String API_KEY = "elabftw.api-key";
  public static final String CATEGORY = "elabftw.experiment-category";
  public static final String STATUS = "elabftw.experiment-status";

  static final String APP_TAG = "NexusLIMS";
  static final String UPLOAD_COMMENT = "NexusLIMS XML record";

  private final DestinationSettings settings;
  private final OkHttpClient httpClient;

  public ElabFtwDestination(DestinationSettings settings) {
    this(settings, HttpClients.defaultClient());
  }

  public ElabFtwDestination(DestinationSettings settings, OkHttpClient httpClient) {
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
    try {
      client().listExperiments(1, 0);
    } catch (ElabFtwAuthenticationException ex) {
      return ValidationResult.invalid("eLabFTW authentication failed: " + ex.getMessage());
    } catch (Exception ex) {
      return ValidationResult.invalid("eLabFTW configuration error: " + ex.getMessage());
    }
    return ValidationResult.ok();
  }

  @Override
  protected ExportResult doExport(ExportContext context) throws Exception {
    ElabFtwClient client = client();
    String title = title(context);
    String cdcsUrl = cdcsUrl(context);

    long experimentId = client.createExperiment(
        title,
        markdownBody(context, cdcsUrl),
        tags(context),
        experimentMetadata(context, cdcsUrl),
        intSetting(CATEGORY),
        intSetting(STATUS));
    logger.log(Level.INFO, "Created eLabFTW experiment {0}: {1}", new Object[]{experimentId, title});

    client.uploadFile(experimentId, context.filePath(), UPLOAD_COMMENT);

    return ExportResult.succeeded(NAME)
        .recordId(Long.toString(experimentId))
        .recordUrl(client.experimentUrl(experimentId))
        .metadata("cdcs_url", cdcsUrl)
        .build();
  }

  ElabFtwClient client() {
    return new ElabFtwClient(settings.get(URL), settings.get(API_KEY), httpClient);
  }

  static String title(ExportContext context) {
    return APP_TAG + " - " + context.instrumentPid() + " - " + context.sessionIdentifier();
  }

  static String markdownBody(ExportContext context, String cdcsUrl) {
    List<String> lines = new ArrayList<>();
    lines.add("# NexusLIMS Microscopy Session");
    lines.add("");
    lines.add("## Session Details");
    lines.add("- **Session ID**: " + context.sessionIdentifier());
    lines.add("- **Instrument**: " + context.instrumentPid());
    if (context.user() != null) {
      lines.add("- **User**: " + context.user());
    }
    lines.add("- **Start**: " + context.timeRangeStart());
    lines.add("- **End**: " + context.timeRangeEnd());
    lines.add("");
    if (cdcsUrl != null) {
      lines.add("## Related Records");
      lines.add("- [View in CDCS](" + cdcsUrl + ")");
      lines.add("");
    }
    lines.add("## Files");
    lines.add("The complete NexusLIMS XML record is attached to this experiment.");
    return String.join("\n", lines);
  }

  static List<String> tags(ExportContext context) {
    List<String> tags = new ArrayList<>();
    tags.add(APP_TAG);
    tags.add(context.instrumentPid());
    if (context.user() != null) {
      tags.add(context.user());
    }
    return tags;
  }

  static Map<String, Object> experimentMetadata(ExportContext context, String cdcsUrl) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("nexuslims_session_id", context.sessionIdentifier());
    metadata.put("instrument", context.instrumentPid());
    metadata.put("start_time", context.timeRangeStart().toString());
    metadata.put("end_time", context.timeRangeEnd().toString());
    if (context.user() != null) {
      metadata.put("user", context.user());
    }
    if (cdcsUrl != null) {
      metadata.put("cdcs_url", cdcsUrl);
    }
    return metadata;
  }

  private static String cdcsUrl(ExportContext context) {
    ExportResult cdcs = context.result(CdcsDestination.NAME);
    return cdcs != null && cdcs.success() ? cdcs.recordUrl() : null;
  }

  private Integer intSetting(String key) {
    String value = settings.get(key);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer, got: " + value, ex);
    }
  }

  /** Service-loader entry point. */
  public static final class Provider implements DestinationProvider {
    @Override
    public ExportDestination create(DestinationSettings settings) {
      return new ElabFtwDestination(settings);
    }
  }
}
