package com.trustbridge.spi;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.models.rotation.ValidationOutcome;

/**
 * Checks a candidate secret before it replaces the current one. A rotation writes the candidate only if every
 * validator that {@link #supports(RotationType) supports} the policy's type returns a valid outcome.
 * Implementations must not throw; problems are reported through the outcome.
 */
public interface SecretValidator {

    boolean supports(RotationType rotationType);

    ValidationOutcome validate(RotationPolicy policy, String candidate);
}
