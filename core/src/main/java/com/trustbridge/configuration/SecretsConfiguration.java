package com.trustbridge.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.audit.AuditLogger;
import com.trustbridge.configuration.properties.CryptoProperties;
import com.trustbridge.configuration.properties.EscProperties;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.secrets.EscClient;
import com.trustbridge.secrets.SecretCache;
import com.trustbridge.secrets.SecretsManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class SecretsConfiguration {

    @Bean
    public SecretCipher secretCipher(CryptoProperties cryptoProperties) {
        return new SecretCipher(cryptoProperties.getKey());
    }

    @Bean(destroyMethod = "close")
    public EscClient escClient(EscProperties escProperties, ObjectMapper objectMapper) {
        return new EscClient(escProperties, objectMapper);
    }

    @Bean
    public SecretsManager secretsManager(EscClient escClient, SecretCipher secretCipher, EscProperties escProperties,
                                         AuditLogger auditLogger, Clock clock) {
        return new SecretsManager(escClient, secretCipher, new SecretCache(escProperties.getCacheTtl(), clock), auditLogger, clock);
    }
}
