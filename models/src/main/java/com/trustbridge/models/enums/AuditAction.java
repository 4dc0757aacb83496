package com.trustbridge.models.enums;

/**
 * Defines the types of operations that are recorded in the audit trail.
 */
public enum AuditAction {
    /**
     * A secret value was read, from the cache or the remote backend.
     */
    SECRET_ACCESS,
    /**
     * A secret key was written for the first time.
     */
    SECRET_CREATE,
    /**
     * An existing secret key was overwritten.
     */
    SECRET_UPDATE,
    SECRET_DELETE,
    /**
     * A secret was regenerated, or a rotation was rolled back.
     */
    SECRET_ROTATE,
    CONFIG_LOAD,
    CONFIG_REFRESH,
    CONFIG_CHANGE,
    AUTHENTICATION,
    AUTHORIZATION,
    CACHE_HIT,
    CACHE_MISS,
    SYSTEM_START,
    SYSTEM_STOP,
    ERROR_OCCURRED
}
