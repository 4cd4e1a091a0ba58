package courier.util;

import java.util.Map;

/**
 * Codec for result metadata maps to/from JSON object text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and handles
 * strings, numbers, booleans, nulls, nested maps and lists. Embedders that already use
 * Jackson or Gson can implement this interface to delegate to it.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Returns {@code null} if the map is null or empty so the
     * outcome log stores SQL {@code NULL} instead of {@code "{}"}.
     *
     * @param values the map to encode
     * @return JSON string, or {@code null}
     */
    String toJson(Map<String, ?> values);

    /**
     * Parses a JSON object. Returns an empty map for {@code null}, blank or {@code "null"} input.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null}); nested objects are maps, arrays are lists
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
