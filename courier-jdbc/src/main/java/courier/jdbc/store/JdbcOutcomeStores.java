package courier.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC outcome stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/courier.jdbc.store.AbstractJdbcOutcomeStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcOutcomeStore store = JdbcOutcomeStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcOutcomeStore store = JdbcOutcomeStores.detect("jdbc:mysql://localhost/lims")
 *     .withTableName("upload_log");
 *
 * // Get by name
 * AbstractJdbcOutcomeStore store = JdbcOutcomeStores.get("postgresql");
 * }</pre>
 */
public final class JdbcOutcomeStores {

    private static final List<AbstractJdbcOutcomeStore> STORES;
    private static final Map<String, AbstractJdbcOutcomeStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcOutcomeStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcOutcomeStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcOutcomeStores() {
    }

    /**
     * Returns all registered outcome stores.
     */
    public static List<AbstractJdbcOutcomeStore> all() {
        return STORES;
    }

    /**
     * Gets an outcome store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcOutcomeStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcOutcomeStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown outcome store: " + name
                    + ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the outcome store from a DataSource.
     *
     * @throws IllegalStateException if the connection URL cannot be read or matches no store
     */
    public static AbstractJdbcOutcomeStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect outcome store from DataSource", e);
        }
    }

    /**
     * Auto-detects the outcome store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store handles the URL
     */
    public static AbstractJdbcOutcomeStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcOutcomeStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No outcome store found for JDBC URL: " + jdbcUrl
                + ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
