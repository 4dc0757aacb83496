package com.trustbridge.models.secrets;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * A cached secret. The value is held encrypted; only the secrets layer can turn it back into plain text.
 */
@Getter
@AllArgsConstructor
public class SecretCacheEntry {
    private final String encryptedValue;
    private final SecretMetadata metadata;
    private final Instant insertedAt;
}
