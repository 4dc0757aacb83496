package com.trustbridge.configuration;

import com.trustbridge.audit.AuditLogger;
import com.trustbridge.configuration.properties.RotationProperties;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.rotation.RollbackStore;
import com.trustbridge.rotation.RotationOrchestrator;
import com.trustbridge.rotation.generators.ApiKeySecretGenerator;
import com.trustbridge.rotation.generators.EncryptionKeySecretGenerator;
import com.trustbridge.rotation.generators.PasswordSecretGenerator;
import com.trustbridge.rotation.generators.TokenSecretGenerator;
import com.trustbridge.rotation.validators.ExternalApiKeyValidator;
import com.trustbridge.rotation.validators.FormatSecretValidator;
import com.trustbridge.secrets.SecretsManager;
import com.trustbridge.spi.RotationNotificationHook;
import com.trustbridge.spi.SecretGenerator;
import com.trustbridge.spi.SecretValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import java.time.Clock;

/**
 * Built-in generators have the lowest precedence: a generator bean with a higher precedence for the same
 * rotation type replaces them.
 */
@Configuration(proxyBeanMethods = false)
public class RotationConfiguration {

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecretGenerator passwordSecretGenerator() {
        return PasswordSecretGenerator.password();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecretGenerator databasePasswordSecretGenerator() {
        return PasswordSecretGenerator.databasePassword();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecretGenerator apiKeySecretGenerator() {
        return new ApiKeySecretGenerator();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecretGenerator tokenSecretGenerator() {
        return new TokenSecretGenerator();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecretGenerator encryptionKeySecretGenerator() {
        return new EncryptionKeySecretGenerator();
    }

    @Bean
    @Order(0)
    public SecretValidator formatSecretValidator() {
        return new FormatSecretValidator();
    }

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "trustbridge.rotation.external-validation", name = "enabled", havingValue = "true")
    public SecretValidator externalApiKeyValidator(RotationProperties rotationProperties, Clock clock) {
        return new ExternalApiKeyValidator(rotationProperties.getExternalValidation(), clock);
    }

    @Bean
    public RollbackStore rollbackStore(SecretCipher secretCipher) {
        return new RollbackStore(secretCipher);
    }

    @Bean(destroyMethod = "shutdown")
    public RotationOrchestrator rotationOrchestrator(SecretsManager secretsManager, AuditLogger auditLogger,
                                                     RotationProperties rotationProperties,
                                                     ObjectProvider<SecretGenerator> generators,
                                                     ObjectProvider<SecretValidator> validators,
                                                     ObjectProvider<RotationNotificationHook> hooks,
                                                     RollbackStore rollbackStore, MeterRegistry meterRegistry, Clock clock) {
        return new RotationOrchestrator(secretsManager, auditLogger, rotationProperties.getPolicies(),
                generators.orderedStream().toList(), validators.orderedStream().toList(), hooks.orderedStream().toList(),
                rollbackStore, meterRegistry, clock);
    }
}
