package com.trustbridge.audit.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.spi.AuditStorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Forwards audit events to the {@value #LOGGER_NAME} logger. The Logback configuration routes that logger to a
 * {@code SyslogAppender}.
 */
public class SyslogAuditStorageBackend implements AuditStorageBackend {

    public static final String TYPE = "syslog";
    public static final String LOGGER_NAME = "trustbridge.audit.syslog";

    private final Logger syslog;
    private final ObjectMapper objectMapper;

    public SyslogAuditStorageBackend(ObjectMapper objectMapper) {
        this(LoggerFactory.getLogger(LOGGER_NAME), objectMapper);
    }

    SyslogAuditStorageBackend(Logger syslog, ObjectMapper objectMapper) {
        this.syslog = syslog;
        this.objectMapper = objectMapper;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void store(List<AuditEvent> events) throws IOException {
        for (AuditEvent event : events) {
            String json = objectMapper.writeValueAsString(event);
            switch (event.getLevel()) {
                case CRITICAL, SECURITY, ERROR -> syslog.error(json);
                case WARNING -> syslog.warn(json);
                case DEBUG -> syslog.debug(json);
                default -> syslog.info(json);
            }
        }
    }
}
