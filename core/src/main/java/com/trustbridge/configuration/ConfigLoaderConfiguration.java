package com.trustbridge.configuration;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.config.ConfigLoader;
import com.trustbridge.configuration.properties.ConfigLoaderProperties;
import com.trustbridge.configuration.properties.EscProperties;
import com.trustbridge.secrets.SecretsManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ConfigLoaderConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ConfigLoader configLoader(SecretsManager secretsManager, AuditLogger auditLogger,
                                     ConfigLoaderProperties configLoaderProperties, EscProperties escProperties, Clock clock) {
        return new ConfigLoader(secretsManager, auditLogger, configLoaderProperties, escProperties.getEnvironment(),
                System::getenv, clock);
    }
}
