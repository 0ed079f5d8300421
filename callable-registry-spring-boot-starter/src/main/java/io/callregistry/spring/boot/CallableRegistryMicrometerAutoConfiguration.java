package io.callregistry.spring.boot;

import io.callregistry.micrometer.MicrometerMetricsExporter;
import io.callregistry.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code callable-registry.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link CallableRegistryAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the registry.
 */
@AutoConfiguration(before = CallableRegistryAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "callable-registry.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CallableRegistryProperties.class)
public class CallableRegistryMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, CallableRegistryProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
