package courier;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State shared by all destinations during the export of one record.
 *
 * <p>Destinations run in priority order and each result is added here before the next
 * destination is called, so a later destination can read what an earlier one produced
 * (for example a CDCS record URL to link from an eLabFTW experiment).
 *
 * <p>Not thread-safe. One instance belongs to one export run and is never reused.
 */
public final class ExportContext {
  private final Path filePath;
  private final String sessionIdentifier;
  private final String instrumentPid;
  private final Instant timeRangeStart;
  private final Instant timeRangeEnd;
  private final String user;
  private final Map<String, Object> metadata;
  private final Map<String, ExportResult> previousResults = new LinkedHashMap<>();
  private final Map<String, ExportResult> previousResultsView =
      Collections.unmodifiableMap(previousResults);

  private ExportContext(Builder builder) {
    this.filePath = Objects.requireNonNull(builder.filePath, "filePath");
    this.sessionIdentifier = Objects.requireNonNull(builder.sessionIdentifier, "sessionIdentifier");
    this.instrumentPid = Objects.requireNonNull(builder.instrumentPid, "instrumentPid");
    this.timeRangeStart = Objects.requireNonNull(builder.timeRangeStart, "timeRangeStart");
    this.timeRangeEnd = Objects.requireNonNull(builder.timeRangeEnd, "timeRangeEnd");
    this.user = builder.user;
    this.metadata = builder.metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a fresh context for exporting {@code filePath} as the record of {@code session}.
   */
  public static ExportContext of(Path filePath, SessionDescriptor session) {
    Objects.requireNonNull(session, "session");
    return builder()
        .filePath(filePath)
        .sessionIdentifier(session.sessionIdentifier())
        .instrumentPid(session.instrumentPid())
        .timeRangeStart(session.start())
        .timeRangeEnd(session.end())
        .user(session.user())
        .metadata(session.metadata())
        .build();
  }

  public Path filePath() {
    return filePath;
  }

  public String sessionIdentifier() {
    return sessionIdentifier;
  }

  public String instrumentPid() {
    return instrumentPid;
  }

  public Instant timeRangeStart() {
    return timeRangeStart;
  }

  public Instant timeRangeEnd() {
    return timeRangeEnd;
  }

  /** Username associated with the session, or {@code null}. */
  public String user() {
    return user;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  /**
   * Returns the result recorded for a destination.
   *
   * @param destinationName destination name
   * @return the result, or {@code null} if that destination has not run in this context
   */
  public ExportResult result(String destinationName) {
    return previousResults.get(destinationName);
  }

  /**
   * Returns whether the named destination has already run in this context and succeeded.
   */
  public boolean hasSuccessfulExport(String destinationName) {
    ExportResult result = previousResults.get(destinationName);
    return result != null && result.success();
  }

  /**
   * Records a destination's result. Adding a name a second time replaces the stored result
   * but keeps its original position.
   */
  public void addResult(String destinationName, ExportResult result) {
    Objects.requireNonNull(destinationName, "destinationName");
    Objects.requireNonNull(result, "result");
    previousResults.put(destinationName, result);
  }

  /**
   * Read-only view of recorded results in insertion order.
   */
  public Map<String, ExportResult> previousResults() {
    return previousResultsView;
  }

  public static final class Builder {
    private Path filePath;
    private String sessionIdentifier;
    private String instrumentPid;
    private Instant timeRangeStart;
    private Instant timeRangeEnd;
    private String user;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder filePath(Path filePath) {
      this.filePath = filePath;
      return this;
    }

    public Builder sessionIdentifier(String sessionIdentifier) {
      this.sessionIdentifier = sessionIdentifier;
      return this;
    }

    public Builder instrumentPid(String instrumentPid) {
      this.instrumentPid = instrumentPid;
      return this;
    }

    public Builder timeRangeStart(Instant timeRangeStart) {
      this.timeRangeStart = timeRangeStart;
      return this;
    }

    public Builder timeRangeEnd(Instant timeRangeEnd) {
      this.timeRangeEnd = timeRangeEnd;
      return this;
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder metadata(String key, Object value) {
      metadata.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder metadata(Map<String, ?> values) {
      if (values != null) {
        metadata.putAll(values);
      }
      return this;
    }

    public ExportContext build() {
      return new ExportContext(this);
    }
  }
}
