package courier.spring.boot;

import courier.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for courier exports.
 *
 * @see CourierAutoConfiguration
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

    /**
     * Export strategy: all, firstSuccess or bestEffort.
     */
    private String strategy = "all";

    /**
     * Database table name for export outcomes.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    /**
     * Whether destination providers are discovered through the service loader.
     */
    private boolean discovery = true;

    /**
     * Destination settings keyed as the destinations read them, e.g. {@code cdcs.url}.
     * Keys missing here fall back to {@code courier.*} system properties and
     * {@code COURIER_*} environment variables.
     */
    private Map<String, String> destinations = new LinkedHashMap<>();

    private final Metrics metrics = new Metrics();

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isDiscovery() {
        return discovery;
    }

    public void setDiscovery(boolean discovery) {
        this.discovery = discovery;
    }

    public Map<String, String> getDestinations() {
        return destinations;
    }

    public void setDestinations(Map<String, String> destinations) {
        this.destinations = destinations;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "courier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
