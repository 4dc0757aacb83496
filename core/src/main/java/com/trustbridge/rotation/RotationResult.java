package com.trustbridge.rotation;

import com.trustbridge.models.rotation.RotationEvent;

/**
 * Outcome of a rotation or rollback request.
 *
 * @param event the rotation event, null when the request was rejected before a rotation started
 */
public record RotationResult(boolean success, RotationEvent event, String message) {

    public static RotationResult succeeded(RotationEvent event, String message) {
        return new RotationResult(true, event, message);
    }

    public static RotationResult failed(RotationEvent event, String message) {
        return new RotationResult(false, event, message);
    }

    public static RotationResult rejected(String message) {
        return new RotationResult(false, null, message);
    }
}
