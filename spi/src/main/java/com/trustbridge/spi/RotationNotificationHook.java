package com.trustbridge.spi;

import com.trustbridge.models.rotation.RotationEvent;

/**
 * Called on every status transition of a rotation, for alerting and integrations.
 * Exceptions thrown by a hook are logged and never abort the rotation.
 */
@FunctionalInterface
public interface RotationNotificationHook {
    void onRotationEvent(RotationEvent event);
}
