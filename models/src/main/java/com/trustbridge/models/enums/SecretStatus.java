package com.trustbridge.models.enums;

/**
 * Lifecycle state of a secret. Secrets are never destroyed, only moved to {@link #DEPRECATED} or {@link #REVOKED}.
 */
public enum SecretStatus {
    ACTIVE,
    ROTATING,
    DEPRECATED,
    REVOKED,
    EXPIRED
}
