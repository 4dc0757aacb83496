package com.trustbridge.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.audit.AuditLogger;
import com.trustbridge.audit.backend.FileAuditStorageBackend;
import com.trustbridge.audit.backend.SyslogAuditStorageBackend;
import com.trustbridge.configuration.properties.AuditProperties;
import com.trustbridge.crypto.SecretCipher;
import com.trustbridge.spi.AuditStorageBackend;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class AuditConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "audit.file", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FileAuditStorageBackend fileAuditStorageBackend(AuditProperties auditProperties, ObjectMapper objectMapper,
                                                           SecretCipher secretCipher, Clock clock) throws IOException {
        AuditProperties.File file = auditProperties.getFile();
        return new FileAuditStorageBackend(Path.of(file.getPath()), objectMapper,
                file.isEncryptionEnabled() ? secretCipher : null, file.isCompressionEnabled(),
                file.getMaxFileSize().toBytes(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "audit.syslog", name = "enabled", havingValue = "true")
    public SyslogAuditStorageBackend syslogAuditStorageBackend(ObjectMapper objectMapper) {
        return new SyslogAuditStorageBackend(objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public AuditLogger auditLogger(AuditProperties auditProperties, ObjectProvider<AuditStorageBackend> backends,
                                   MeterRegistry meterRegistry, Clock clock) {
        return new AuditLogger(auditProperties, backends.orderedStream().toList(), meterRegistry, clock);
    }
}
