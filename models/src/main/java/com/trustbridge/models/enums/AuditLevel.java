package com.trustbridge.models.enums;

/**
 * Severity of an audit event. {@link #CRITICAL} and {@link #SECURITY} events are flushed to storage immediately.
 */
public enum AuditLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL,
    SECURITY;

    public boolean requiresImmediateFlush() {
        return this == CRITICAL || this == SECURITY;
    }
}
