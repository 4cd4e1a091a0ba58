package courier.model;

import courier.ExportResult;

import java.time.Instant;
import java.util.Objects;

/**
 * One outcome log row.
 *
 * @param id database id, {@code null} before insert
 * @param sessionIdentifier exported session
 * @param destinationName destination that was attempted
 * @param success whether the attempt succeeded
 * @param recordId remote record id, nullable
 * @param recordUrl remote record URL, nullable
 * @param errorMessage failure cause, nullable
 * @param timestamp when the attempt finished
 * @param metadataJson result metadata as a JSON object, {@code null} when empty
 */
public record OutcomeRecord(
    Long id,
    String sessionIdentifier,
    String destinationName,
    boolean success,
    String recordId,
    String recordUrl,
    String errorMessage,
    Instant timestamp,
    String metadataJson
) {
  public OutcomeRecord {
    Objects.requireNonNull(sessionIdentifier, "sessionIdentifier");
    Objects.requireNonNull(destinationName, "destinationName");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Builds an unsaved row from an export result.
   */
  public static OutcomeRecord of(String sessionIdentifier, ExportResult result, String metadataJson) {
    return new OutcomeRecord(
        null,
        sessionIdentifier,
        result.destinationName(),
        result.success(),
        result.recordId(),
        result.recordUrl(),
        result.errorMessage(),
        result.timestamp(),
        metadataJson);
  }
}
