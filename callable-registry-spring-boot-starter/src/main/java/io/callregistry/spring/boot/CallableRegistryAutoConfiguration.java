package io.callregistry.spring.boot;

import io.callregistry.CallableRegistry;
import io.callregistry.dispatch.DispatchInterceptor;
import io.callregistry.dispatch.LoggingDispatchInterceptor;
import io.callregistry.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.logging.Level;

/**
 * Auto-configuration for the callable registry.
 *
 * <p>Creates one {@code CallableRegistry<Object>} from {@link CallableRegistryProperties},
 * picking up an optional {@link MetricsExporter} bean and every {@link DispatchInterceptor}
 * bean in order, then applies all {@link RegistrationCustomizer} beans.
 *
 * @see CallableRegistryProperties
 * @see CallableRegistryMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(CallableRegistry.class)
@EnableConfigurationProperties(CallableRegistryProperties.class)
public class CallableRegistryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CallableRegistry<Object> callableRegistry(CallableRegistryProperties props,
                                                     ObjectProvider<MetricsExporter> metricsProvider,
                                                     ObjectProvider<DispatchInterceptor> interceptorProvider,
                                                     ObjectProvider<RegistrationCustomizer> customizers) {
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        List<DispatchInterceptor> interceptors = interceptorProvider.orderedStream().toList();

        var builder = CallableRegistry.builder()
                .name(props.getName())
                .bindMetadata(props.isBindMetadata())
                .interceptors(interceptors);
        if (props.getTrace().isEnabled()) {
            builder.interceptor(new LoggingDispatchInterceptor(Level.parse(props.getTrace().getLevel())));
        }
        if (metrics != null) {
            builder.metrics(metrics);
        }
        CallableRegistry<Object> registry = builder.build();
        customizers.orderedStream().forEach(customizer -> customizer.customize(registry));
        return registry;
    }
}
