package com.trustbridge.models.secrets;

import com.trustbridge.models.enums.SecretScope;
import com.trustbridge.models.enums.SecretStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Bookkeeping for a secret held by the secrets layer. Never contains the secret value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretMetadata {

    private String key;

    @Builder.Default
    private SecretScope scope = SecretScope.ENVIRONMENT;

    private Instant createdAt;

    private Instant lastAccessed;

    private Instant lastRotated;

    @Builder.Default
    private int rotationIntervalDays = 90;

    private long accessCount;

    @Builder.Default
    private SecretStatus status = SecretStatus.ACTIVE;

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    public void recordAccess(Instant when) {
        this.lastAccessed = when;
        this.accessCount++;
    }
}
