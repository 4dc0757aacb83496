package com.trustbridge.rotation.generators;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.rotation.RandomSecrets;
import com.trustbridge.spi.SecretGenerator;

import java.util.Base64;

/**
 * 256 bit keys, standard base64.
 */
public class EncryptionKeySecretGenerator implements SecretGenerator {

    public static final int KEY_BYTES = 32;

    @Override
    public RotationType type() {
        return RotationType.ENCRYPTION_KEY;
    }

    @Override
    public String generate(RotationPolicy policy, String currentValue) {
        return Base64.getEncoder().encodeToString(RandomSecrets.bytes(KEY_BYTES));
    }
}
