package com.trustbridge.app.audit;

import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.spi.AuditStorageBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Keeps the audit trail in the embedded Derby table {@code audit_events}, one row per event with the serialized
 * event and its timestamp. Rotation deletes rows older than the retention.
 */
@Slf4j
public class DerbyAuditStorageBackend implements AuditStorageBackend {

    public static final String TYPE = "database";

    private final DerbyDao derbyDao;
    private final Duration retention;
    private final Clock clock;
    private volatile boolean closed;

    public DerbyAuditStorageBackend(DerbyDao derbyDao, Duration retention, Clock clock) {
        this.derbyDao = derbyDao;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void store(List<AuditEvent> events) throws IOException {
        if (closed) {
            throw new IOException("Derby audit storage is closed");
        }
        try {
            derbyDao.insertAuditEvents(events);
        } catch (SQLException e) {
            throw new IOException("Failed to insert " + events.size() + " audit events", e);
        }
    }

    @Override
    public void rotate() throws IOException {
        Instant cutoff = clock.instant().minus(retention);
        try {
            int deleted = derbyDao.deleteAuditEventsBefore(cutoff);
            log.info("Deleted {} audit events older than {}", deleted, cutoff);
        } catch (SQLException e) {
            throw new IOException("Failed to delete audit events older than " + cutoff, e);
        }
    }

    @Override
    public List<AuditEvent> readEvents(Instant from, Instant to) throws IOException {
        try {
            return derbyDao.fetchAuditEvents(from, to);
        } catch (SQLException e) {
            throw new IOException("Failed to read audit events", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            derbyDao.shutdown();
        } catch (SQLException e) {
            throw new IOException("Failed to shut down the Derby audit database", e);
        }
    }
}
