package courier;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Session facts supplied by the record-building pipeline for one exported file.
 *
 * @param sessionIdentifier stable session id
 * @param instrumentPid instrument identifier
 * @param start session start
 * @param end session end
 * @param user username, may be {@code null}
 * @param metadata extra facts copied into the {@link ExportContext}; null values are kept
 */
public record SessionDescriptor(
    String sessionIdentifier,
    String instrumentPid,
    Instant start,
    Instant end,
    String user,
    Map<String, Object> metadata
) {
  public SessionDescriptor {
    Objects.requireNonNull(sessionIdentifier, "sessionIdentifier");
    Objects.requireNonNull(instrumentPid, "instrumentPid");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public SessionDescriptor(String sessionIdentifier, String instrumentPid, Instant start, Instant end, String user) {
    this(sessionIdentifier, instrumentPid, start, end, user, Map.of());
  }
}
