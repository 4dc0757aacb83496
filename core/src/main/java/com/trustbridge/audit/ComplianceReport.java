package com.trustbridge.audit;

import com.trustbridge.models.audit.AuditEvent;
import com.trustbridge.models.enums.AuditAction;
import com.trustbridge.models.enums.AuditLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of the audit trail over a time window.
 *
 * @param failedEvents the failed events of the window, only populated for {@code detailed} reports
 */
public record ComplianceReport(String reportType,
                               Instant periodStart,
                               Instant periodEnd,
                               Instant generatedAt,
                               long totalEvents,
                               Map<AuditLevel, Long> eventsByLevel,
                               Map<AuditAction, Long> eventsByAction,
                               long integrityViolations,
                               long storageErrors,
                               SecuritySummary security,
                               List<AuditEvent> failedEvents) {

    public static final String SUMMARY = "summary";
    public static final String DETAILED = "detailed";

    public record SecuritySummary(long authenticationEvents,
                                  long authorizationEvents,
                                  long failedOperations,
                                  long securityEvents,
                                  long secretAccesses) {
    }
}
