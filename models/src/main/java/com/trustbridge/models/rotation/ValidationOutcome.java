package com.trustbridge.models.rotation;

/**
 * Result of validating a candidate secret.
 *
 * @param valid       whether the candidate may be written
 * @param validator   name of the validator that produced the outcome
 * @param message     human readable reason, never containing the secret
 */
public record ValidationOutcome(boolean valid, String validator, String message) {

    public static ValidationOutcome valid(String validator) {
        return new ValidationOutcome(true, validator, "valid");
    }

    public static ValidationOutcome invalid(String validator, String message) {
        return new ValidationOutcome(false, validator, message);
    }
}
