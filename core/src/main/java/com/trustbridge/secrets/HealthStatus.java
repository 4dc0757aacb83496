package com.trustbridge.secrets;

import java.time.Instant;

public record HealthStatus(String status,
                           boolean backendReachable,
                           int cacheSize,
                           boolean cacheValid,
                           Instant lastAuditTime,
                           Instant checkedAt) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
