package com.trustbridge.models.enums;

/**
 * States of a single rotation. {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}, and {@code COMPLETED -> ROLLBACK}
 * while the rollback window is open.
 */
public enum RotationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ROLLBACK;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLBACK;
    }
}
