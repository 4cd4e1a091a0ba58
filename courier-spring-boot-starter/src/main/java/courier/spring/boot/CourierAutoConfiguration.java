package courier.spring.boot;

import courier.DestinationSettings;
import courier.ExportConfig;
import courier.ExportDestination;
import courier.ExportOrchestrator;
import courier.jdbc.DataSourceConnectionProvider;
import courier.jdbc.TableNames;
import courier.jdbc.store.AbstractJdbcOutcomeStore;
import courier.jdbc.store.JdbcOutcomeStores;
import courier.registry.DefaultDestinationRegistry;
import courier.spi.ConnectionProvider;
import courier.spi.ExportMetrics;
import courier.strategy.ExportStrategy;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Auto-configuration for courier exports.
 *
 * <p>Wires an {@link ExportOrchestrator} from a {@link DataSource} and
 * {@link CourierProperties}. Destinations come from the service loader and from any
 * {@link ExportDestination} beans in the context.
 *
 * @see CourierProperties
 * @see CourierMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ExportOrchestrator.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DestinationSettings destinationSettings(CourierProperties props) {
    Map<String, String> configured = Map.copyOf(props.getDestinations());
    DestinationSettings fallback = DestinationSettings.system();
    return key -> {
      String value = configured.get(key);
      return value != null ? value : fallback.raw(key);
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcOutcomeStore outcomeStore(DataSource dataSource, CourierProperties props) {
    AbstractJdbcOutcomeStore detected = JdbcOutcomeStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultDestinationRegistry destinationRegistry(CourierProperties props,
      DestinationSettings settings,
      ObjectProvider<ExportMetrics> metricsProvider,
      ObjectProvider<ExportDestination> destinationProvider) {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(settings)
        .metrics(metricsProvider.getIfAvailable(() -> ExportMetrics.NOOP))
        .discovery(props.isDiscovery())
        .build();
    destinationProvider.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public ExportConfig exportConfig(CourierProperties props) {
    // Resolve eagerly so a misspelt strategy fails at startup
    return new ExportConfig().setExportStrategy(ExportStrategy.fromName(props.getStrategy()));
  }

  @Bean
  @ConditionalOnMissingBean
  public ExportOrchestrator exportOrchestrator(DefaultDestinationRegistry destinationRegistry,
      ExportConfig exportConfig,
      AbstractJdbcOutcomeStore outcomeStore,
      ConnectionProvider connectionProvider,
      ObjectProvider<ExportMetrics> metricsProvider) {
    ExportOrchestrator.Builder builder = ExportOrchestrator.builder()
        .registry(destinationRegistry)
        .config(exportConfig)
        .outcomeStore(outcomeStore)
        .connectionProvider(connectionProvider);
    ExportMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
