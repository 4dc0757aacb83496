package com.trustbridge.configuration;

import com.trustbridge.EscIntegration;
import com.trustbridge.audit.AuditLogger;
import com.trustbridge.config.ConfigLoader;
import com.trustbridge.configuration.properties.IntegrationProperties;
import com.trustbridge.configuration.properties.RotationProperties;
import com.trustbridge.rotation.RotationOrchestrator;
import com.trustbridge.secrets.SecretsManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class IntegrationConfiguration {

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public EscIntegration escIntegration(ConfigLoader configLoader, SecretsManager secretsManager,
                                         RotationOrchestrator rotationOrchestrator, AuditLogger auditLogger,
                                         IntegrationProperties integrationProperties, RotationProperties rotationProperties,
                                         Clock clock) {
        return new EscIntegration(configLoader, secretsManager, rotationOrchestrator, auditLogger,
                integrationProperties, rotationProperties, clock);
    }
}
