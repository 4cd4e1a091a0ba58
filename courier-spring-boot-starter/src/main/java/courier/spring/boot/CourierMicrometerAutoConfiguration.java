package courier.spring.boot;

import courier.micrometer.MicrometerExportMetrics;
import courier.spi.ExportMetrics;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerExportMetrics} when Micrometer is on the classpath and
 * {@code courier.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link CourierAutoConfiguration} so the {@link ExportMetrics} bean is
 * available to the registry and orchestrator.
 */
@AutoConfiguration(before = CourierAutoConfiguration.class)
@ConditionalOnClass({MicrometerExportMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "courier.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(ExportMetrics.class)
  public MicrometerExportMetrics micrometerExportMetrics(MeterRegistry meterRegistry, CourierProperties props) {
    return new MicrometerExportMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
