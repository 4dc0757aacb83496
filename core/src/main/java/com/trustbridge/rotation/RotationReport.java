package com.trustbridge.rotation;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-secret rotation overview. Events carry secret hints only. Overdue environments hold a secret older than the
 * policy's maximum age plus grace period.
 */
public record RotationReport(Instant generatedAt,
                             RotationStatistics statistics,
                             List<SecretRotationSummary> secrets) {

    public record SecretRotationSummary(String secretKey,
                                        RotationType rotationType,
                                        int intervalDays,
                                        boolean autoRotate,
                                        List<String> environments,
                                        Map<String, Instant> lastRotated,
                                        Map<String, Instant> nextDue,
                                        List<String> overdueEnvironments,
                                        List<RotationEvent> history) {
    }
}
