package io.eventsource.spring.boot;

import io.eventsource.micrometer.MicrometerMetricsExporter;
import io.eventsource.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code eventsource.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventSourcingAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.eventsource.EventSourcing} bean.
 */
@AutoConfiguration(before = EventSourcingAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "eventsource.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventSourcingMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, EventSourcingProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
