package com.trustbridge.rotation;

public record RotationStatistics(long totalRotations,
                                 long completed,
                                 long failed,
                                 long rolledBack,
                                 int activeRotations,
                                 int pendingRollbacks,
                                 int managedSecrets,
                                 double successRate) {
}
