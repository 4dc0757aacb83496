package com.trustbridge.rotation.generators;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.rotation.RandomSecrets;
import com.trustbridge.spi.SecretGenerator;

public class TokenSecretGenerator implements SecretGenerator {

    public static final int TOKEN_BYTES = 32;

    @Override
    public RotationType type() {
        return RotationType.TOKEN;
    }

    @Override
    public String generate(RotationPolicy policy, String currentValue) {
        return RandomSecrets.base64Url(TOKEN_BYTES);
    }
}
