package com.trustbridge.rotation.generators;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.rotation.ApiKeyTemplate;
import com.trustbridge.rotation.RandomSecrets;
import com.trustbridge.spi.SecretGenerator;

/**
 * Produces a key in the format of the provider named by the secret key.
 */
public class ApiKeySecretGenerator implements SecretGenerator {

    @Override
    public RotationType type() {
        return RotationType.API_KEY;
    }

    @Override
    public String generate(RotationPolicy policy, String currentValue) {
        ApiKeyTemplate template = ApiKeyTemplate.forKey(policy.getSecretKey());
        return template.getPrefix() + RandomSecrets.fromAlphabet(template.getAlphabet(), template.getRandomLength());
    }
}
