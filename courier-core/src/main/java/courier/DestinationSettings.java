package courier;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only key/value settings handed to destination providers.
 *
 * <p>Keys are dotted and lower-case, e.g. {@code cdcs.url} or {@code elabftw.api-key}.
 * Blank values are treated as absent.
 */
@FunctionalInterface
public interface DestinationSettings {

    /**
     * Returns the raw value for a key, or {@code null} if absent.
     */
    String raw(String key);

    /**
     * Returns the trimmed value for a key, or {@code null} if absent or blank.
     */
    default String get(String key) {
        String value = raw(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    default String get(String key, String defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : value;
    }

    default boolean has(String key) {
        return get(key) != null;
    }

    /**
     * Settings with no values.
     */
    static DestinationSettings empty() {
        return key -> null;
    }

    /**
     * Settings backed by a copy of the given map.
     */
    static DestinationSettings of(Map<String, String> values) {
        Map<String, String> copy = new HashMap<>(Objects.requireNonNull(values, "values"));
        return copy::get;
    }

    /**
     * Settings read from JVM system property {@code courier.<key>}, falling back to the
     * environment variable {@code COURIER_<KEY>} (upper case, {@code .} and {@code -}
     * replaced by {@code _}).
     */
    static DestinationSettings system() {
        return key -> {
            String value = System.getProperty("courier." + key);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return System.getenv(environmentName(key));
        };
    }

    /**
     * Maps a settings key to its environment variable name.
     */
    static String environmentName(String key) {
        return "COURIER_" + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
