package com.trustbridge;

import com.trustbridge.configuration.AuditConfiguration;
import com.trustbridge.configuration.IntegrationConfiguration;
import com.trustbridge.configuration.RotationConfiguration;
import com.trustbridge.configuration.SecretsConfiguration;
import com.trustbridge.configuration.ConfigLoaderConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;

@AutoConfiguration(after = JacksonAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConfigurationPropertiesScan
@Import({AuditConfiguration.class, SecretsConfiguration.class, ConfigLoaderConfiguration.class,
        RotationConfiguration.class, IntegrationConfiguration.class})
public class TrustBridgeConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
