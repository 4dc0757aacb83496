package com.trustbridge.audit.backend;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.Logger;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class SyslogAuditStorageBackendTest {

    private final JsonMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @ParameterizedTest
    @CsvSource({
            "SECURITY, error",
            "CRITICAL, error",
            "ERROR, error",
            "WARNING, warn",
            "INFO, info",
            "DEBUG, debug"
    })
    void shouldMapAuditLevelToLogLevel(AuditLevel level, String expected) throws IOException {
        // Given
        Logger logger = mock(Logger.class);
        SyslogAuditStorageBackend backend = new SyslogAuditStorageBackend(logger, objectMapper);

        // When
        backend.store(List.of(AuditEvent.builder().level(level).action(AuditAction.SECRET_ACCESS).resource("k").build().seal()));

        // Then
        switch (expected) {
            case "error" -> verify(logger).error(contains("\"resource\":\"k\""));
            case "warn" -> verify(logger).warn(contains("\"resource\":\"k\""));
            case "debug" -> verify(logger).debug(contains("\"resource\":\"k\""));
            default -> verify(logger).info(contains("\"resource\":\"k\""));
        }
        verifyNoMoreInteractions(logger);
    }

    @Test
    void shouldUseDedicatedLoggerByDefault() {
        assertThat(new SyslogAuditStorageBackend(objectMapper).type()).isEqualTo("syslog");
    }
}
