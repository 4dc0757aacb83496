package com.trustbridge.audit;

import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;

import java.time.Instant;
import java.util.Map;

/**
 * Point in time view of the audit logger counters.
 */
public record AuditStatistics(long totalEvents,
                              Map<AuditLevel, Long> eventsByLevel,
                              Map<AuditAction, Long> eventsByAction,
                              long integrityViolations,
                              long storageErrors,
                              long flushes,
                              int bufferedEvents,
                              Instant lastFlush,
                              Instant lastEvent) {
}
