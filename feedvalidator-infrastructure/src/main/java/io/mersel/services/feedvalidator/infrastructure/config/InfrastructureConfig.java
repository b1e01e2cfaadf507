package io.mersel.services.feedvalidator.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration of the infrastructure layer.
 * <p>
 * Scans every component of this layer (loaders, rule engine, OCD-ID cache, metrics)
 * and enables the rule and OCD-ID configuration properties.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.feedvalidator.infrastructure")
@EnableConfigurationProperties({ValidatorProperties.class, OcdIdProperties.class})
public class InfrastructureConfig {

    /**
     * In-memory registry for command line runs without a metrics backend.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Clock used by the date rules.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
