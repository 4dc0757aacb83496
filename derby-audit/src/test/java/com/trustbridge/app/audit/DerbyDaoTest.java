package com.trustbridge.app.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustbridge.models.audit.AuditContext;
import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DerbyDaoTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private DerbyDao derbyDao;

    @BeforeEach
    void setUp() throws SQLException {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        derbyDao = new DerbyDao("jdbc:derby:memory:" + UUID.randomUUID() + ";create=true", objectMapper);
        derbyDao.init();
    }

    @AfterEach
    void tearDown() throws SQLException {
        derbyDao.shutdown();
    }

    @Test
    void shouldInsertAndFetchAuditEvents() throws Exception {
        derbyDao.insertAuditEvents(List.of(event("evt-1", T0), event("evt-2", T0.plusSeconds(1))));

        List<AuditEvent> fetched = derbyDao.fetchAuditEvents(T0, T0.plusSeconds(60));

        assertEquals(2, fetched.size());
        assertEquals("evt-1", fetched.get(0).getEventId());
        assertEquals(AuditAction.SECRET_ACCESS, fetched.get(0).getAction());
        assertTrue(fetched.get(0).verifyIntegrity());
    }

    @Test
    void shouldFetchOnlyTheRequestedWindow() throws Exception {
        derbyDao.insertAuditEvents(List.of(event("early", T0), event("inside", T0.plusSeconds(3600)), event("late", T0.plusSeconds(7200))));

        List<AuditEvent> fetched = derbyDao.fetchAuditEvents(T0.plusSeconds(1), T0.plusSeconds(3600));

        assertEquals(1, fetched.size());
        assertEquals("inside", fetched.get(0).getEventId());
    }

    @Test
    void shouldDeleteEventsBeforeCutoff() throws Exception {
        derbyDao.insertAuditEvents(List.of(event("old-1", T0), event("old-2", T0.plusSeconds(1)), event("new", T0.plusSeconds(3600))));

        int deleted = derbyDao.deleteAuditEventsBefore(T0.plusSeconds(60));

        assertEquals(2, deleted);
        assertEquals(1, derbyDao.countAuditEvents());
    }

    @Test
    void shouldToleratePreviouslyCreatedTable() {
        assertDoesNotThrow(derbyDao::init);
    }

    private static AuditEvent event(String id, Instant timestamp) {
        return AuditEvent.builder()
                .eventId(id)
                .timestamp(timestamp)
                .level(AuditLevel.INFO)
                .action(AuditAction.SECRET_ACCESS)
                .resource("openai_api_key")
                .message("Secret accessed")
                .context(AuditContext.system("trustbridge", "prod"))
                .data(Map.of("cached", true, "durationMs", 4L))
                .build()
                .seal();
    }
}
