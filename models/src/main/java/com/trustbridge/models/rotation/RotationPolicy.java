package com.trustbridge.models.rotation;

import com.trustbridge.models.enums.RotationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static rule describing how often and how a managed secret is regenerated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RotationPolicy {

    private String secretKey;

    private RotationType rotationType;

    @Builder.Default
    private int intervalDays = 30;

    /**
     * Age after which a rotated secret is reported overdue, extended by {@link #gracePeriodHours}.
     */
    @Builder.Default
    private int maxAgeDays = 90;

    @Builder.Default
    private int gracePeriodHours = 24;

    @Builder.Default
    private boolean autoRotate = true;

    @Builder.Default
    private int rollbackTimeoutMinutes = 60;

    @Builder.Default
    private boolean validationRequired = true;

    @Builder.Default
    private List<String> environments = new ArrayList<>(List.of("dev", "staging", "prod"));

    /**
     * Fails fast on a policy that can never be applied.
     *
     * @throws IllegalArgumentException if the policy is invalid
     */
    public void validate() {
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("rotation policy requires a secret key");
        }
        if (rotationType == null) {
            throw new IllegalArgumentException("rotation policy for " + secretKey + " requires a rotation type");
        }
        if (intervalDays < 1) {
            throw new IllegalArgumentException("intervalDays must be at least 1 for " + secretKey);
        }
        if (maxAgeDays < intervalDays) {
            throw new IllegalArgumentException("maxAgeDays must not be lower than intervalDays for " + secretKey);
        }
        if (rollbackTimeoutMinutes < 0) {
            throw new IllegalArgumentException("rollbackTimeoutMinutes must not be negative for " + secretKey);
        }
        if (environments == null || environments.isEmpty()) {
            throw new IllegalArgumentException("rotation policy for " + secretKey + " has no environments");
        }
    }

    public boolean appliesTo(String environment) {
        return environments != null && environments.contains(environment);
    }
}
