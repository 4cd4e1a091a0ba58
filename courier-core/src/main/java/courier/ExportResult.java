package courier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of one export attempt to one destination.
 *
 * <p>A successful result may carry the remote record id and URL but never an error message.
 * A failed result always carries an error message and never an id or URL. Both factories
 * and the {@link Builder} enforce this.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExportResult ok = ExportResult.success("cdcs", "42", "https://cdcs.example/data?id=42");
 *
 * ExportResult failed = ExportResult.failed("elabftw", "HTTP 500")
 *     .metadata("cdcs_url", cdcsUrl)
 *     .build();
 * }</pre>
 *
 * @see ExportContext
 * @see ExportDestination
 */
public final class ExportResult {
  private final boolean success;
  private final String destinationName;
  private final String recordId;
  private final String recordUrl;
  private final String errorMessage;
  private final Instant timestamp;
  private final Map<String, Object> metadata;

  private ExportResult(Builder builder) {
    this.success = builder.success;
    this.destinationName = Objects.requireNonNull(builder.destinationName, "destinationName");
    this.recordId = builder.recordId;
    this.recordUrl = builder.recordUrl;
    this.errorMessage = builder.errorMessage;
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.metadata = builder.metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    if (success && errorMessage != null) {
      throw new IllegalArgumentException("A successful result cannot carry an error message");
    }
    if (!success) {
      if (errorMessage == null) {
        throw new IllegalArgumentException("A failed result requires an error message");
      }
      if (recordId != null || recordUrl != null) {
        throw new IllegalArgumentException("A failed result cannot carry a record id or URL");
      }
    }
  }

  /**
   * Creates a successful result stamped with the current time.
   *
   * @param destinationName the destination's {@link ExportDestination#name()}
   * @param recordId remote record id, may be {@code null}
   * @param recordUrl remote record URL, may be {@code null}
   * @return the result
   */
  public static ExportResult success(String destinationName, String recordId, String recordUrl) {
    return succeeded(destinationName).recordId(recordId).recordUrl(recordUrl).build();
  }

  /**
   * Creates a failed result stamped with the current time.
   *
   * @param destinationName the destination's {@link ExportDestination#name()}
   * @param errorMessage human-readable cause, required
   * @return the result
   */
  public static ExportResult failure(String destinationName, String errorMessage) {
    return failed(destinationName, errorMessage).build();
  }

  public static Builder succeeded(String destinationName) {
    return new Builder(true, destinationName);
  }

  public static Builder failed(String destinationName, String errorMessage) {
    return new Builder(false, destinationName).errorMessage(errorMessage);
  }

  public boolean success() {
    return success;
  }

  public String destinationName() {
    return destinationName;
  }

  public String recordId() {
    return recordId;
  }

  public String recordUrl() {
    return recordUrl;
  }

  public String errorMessage() {
    return errorMessage;
  }

  public Instant timestamp() {
    return timestamp;
  }

  /**
   * Destination-specific facts about the attempt (never {@code null}, unmodifiable).
   */
  public Map<String, Object> metadata() {
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExportResult)) {
      return false;
    }
    ExportResult that = (ExportResult) o;
    return success == that.success
        && destinationName.equals(that.destinationName)
        && Objects.equals(recordId, that.recordId)
        && Objects.equals(recordUrl, that.recordUrl)
        && Objects.equals(errorMessage, that.errorMessage)
        && timestamp.equals(that.timestamp)
        && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(success, destinationName, recordId, recordUrl, errorMessage, timestamp, metadata);
  }

  @Override
  public String toString() {
    return "ExportResult{"
        + "destination=" + destinationName
        + ", success=" + success
        + (recordId != null ? ", recordId=" + recordId : "")
        + (recordUrl != null ? ", recordUrl=" + recordUrl : "")
        + (errorMessage != null ? ", error=" + errorMessage : "")
        + ", timestamp=" + timestamp
        + '}';
  }

  public static final class Builder {
    private final boolean success;
    private final String destinationName;
    private String recordId;
    private String recordUrl;
    private String errorMessage;
    private Instant timestamp;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Builder(boolean success, String destinationName) {
      this.success = success;
      this.destinationName = Objects.requireNonNull(destinationName, "destinationName");
    }

    public Builder recordId(String recordId) {
      this.recordId = recordId;
      return this;
    }

    public Builder recordUrl(String recordUrl) {
      this.recordUrl = recordUrl;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder metadata(String key, Object value) {
      Objects.requireNonNull(key, "key");
      if (value != null) {
        metadata.put(key, frozen(value));
      }
      return this;
    }

    public Builder metadata(Map<String, ?> values) {
      if (values != null) {
        values.forEach(this::metadata);
      }
      return this;
    }

    public ExportResult build() {
      return new ExportResult(this);
    }
  }

  /** Copies nested maps, collections and object arrays into unmodifiable snapshots. */
  private static Object frozen(Object value) {
    if (value instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, frozen(v)));
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Collection) {
      return frozenList(((Collection<?>) value).toArray());
    }
    if (value instanceof Object[]) {
      return frozenList((Object[]) value);
    }
    return value;
  }

  private static List<Object> frozenList(Object[] items) {
    List<Object> copy = new ArrayList<>(items.length);
    for (Object item : items) {
      copy.add(frozen(item));
    }
    return Collections.unmodifiableList(copy);
  }
}
