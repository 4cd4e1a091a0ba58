package courier.spring.boot;

import courier.micrometer.MicrometerExportMetrics;
import courier.spi.ExportMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourierMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CourierMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerExportMetrics"));
            assertInstanceOf(MicrometerExportMetrics.class, ctx.getBean(ExportMetrics.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("courier.metrics.name-prefix=lims.courier").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("lims.courier.record.exported").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("courier.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerExportMetrics")));
    }

    @Test
    void backsOffWhenCustomMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx ->
                assertSame(ExportMetrics.NOOP, ctx.getBean(ExportMetrics.class)));
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomMetricsConfig {
        @Bean
        ExportMetrics customMetrics() {
            return ExportMetrics.NOOP;
        }
    }
}
