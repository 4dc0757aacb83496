package com.trustbridge.app.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.TrustBridgeConfiguration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@AutoConfiguration(after = TrustBridgeConfiguration.class)
@ConditionalOnProperty(prefix = "audit.database", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(DerbyAuditProperties.class)
public class DerbyAuditConfiguration {

    // shut down through the storage backend
    @Bean(destroyMethod = "")
    public DerbyDao derbyDao(DerbyAuditProperties derbyAuditProperties, ObjectMapper objectMapper) {
        return new DerbyDao(derbyAuditProperties.getDerbyUrl(), objectMapper);
    }

    @Bean
    public DerbyAuditStorageBackend derbyAuditStorageBackend(DerbyDao derbyDao, DerbyAuditProperties derbyAuditProperties, Clock clock) {
        return new DerbyAuditStorageBackend(derbyDao, derbyAuditProperties.getRetention(), clock);
    }
}
