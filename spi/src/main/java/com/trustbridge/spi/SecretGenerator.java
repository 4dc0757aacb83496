package com.trustbridge.spi;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;

/**
 * Produces new secret values during rotation. One generator is registered per {@link RotationType};
 * new kinds of secrets are supported by adding a generator bean, without changes to the orchestrator.
 */
public interface SecretGenerator {

    RotationType type();

    /**
     * Generates a candidate value for the secret described by the policy.
     *
     * @param policy       the rotation policy of the secret
     * @param currentValue the value being replaced, may be null
     * @return the new value, never null
     */
    String generate(RotationPolicy policy, String currentValue);
}
