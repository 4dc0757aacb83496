package com.trustbridge.models.rotation;

import com.trustbridge.models.enums.RotationStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Record of one rotation attempt. Only secret hints (last four characters) are kept, never full values.
 * <p>
 * The status moves forward only: a terminal status is set once, with the exception of the
 * {@code COMPLETED -> ROLLBACK} transition.
 */
@Getter
@ToString
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RotationEvent {

    private final String eventId;
    private final String rotationId;
    private final String secretKey;
    private final String environment;
    private final Instant startedAt;
    private volatile RotationStatus status;
    private volatile Instant completedAt;
    private volatile String oldSecretHint;
    private volatile String newSecretHint;
    private volatile boolean rollbackAvailable;
    private volatile String errorMessage;

    public synchronized void markInProgress() {
        requireStatus(RotationStatus.PENDING);
        this.status = RotationStatus.IN_PROGRESS;
    }

    public synchronized void markCompleted(Instant when, String oldHint, String newHint, boolean rollbackAvailable) {
        requireStatus(RotationStatus.IN_PROGRESS);
        this.status = RotationStatus.COMPLETED;
        this.completedAt = when;
        this.oldSecretHint = oldHint;
        this.newSecretHint = newHint;
        this.rollbackAvailable = rollbackAvailable;
    }

    public synchronized void markFailed(Instant when, String errorMessage) {
        if (status != RotationStatus.PENDING && status != RotationStatus.IN_PROGRESS) {
            throw new IllegalStateException("rotation " + eventId + " is already " + status);
        }
        this.status = RotationStatus.FAILED;
        this.completedAt = when;
        this.errorMessage = errorMessage;
        this.rollbackAvailable = false;
    }

    public synchronized void markRolledBack(Instant when) {
        requireStatus(RotationStatus.COMPLETED);
        this.status = RotationStatus.ROLLBACK;
        this.completedAt = when;
        this.rollbackAvailable = false;
    }

    public synchronized void expireRollback() {
        this.rollbackAvailable = false;
    }

    private void requireStatus(RotationStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("rotation " + eventId + " is " + status + ", expected " + expected);
        }
    }

    /**
     * Last four characters of a secret, or {@code ****} for short or missing values.
     */
    public static String hint(String secret) {
        if (secret == null || secret.length() < 4) {
            return "****";
        }
        return secret.substring(secret.length() - 4);
    }
}
