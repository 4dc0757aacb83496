package com.trustbridge.rotation.validators;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.models.rotation.ValidationOutcome;
import com.trustbridge.rotation.ApiKeyTemplate;
import com.trustbridge.spi.SecretValidator;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Offline checks of a candidate's shape: length and character classes for passwords, provider formats for API keys,
 * decodability for tokens and encryption keys.
 */
public class FormatSecretValidator implements SecretValidator {

    public static final String NAME = "format";

    static final int MIN_PASSWORD_LENGTH = 16;
    static final int MIN_TOKEN_LENGTH = 32;

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SYMBOL = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern BASE64_URL = Pattern.compile("^[A-Za-z0-9_-]+$");

    @Override
    public boolean supports(RotationType rotationType) {
        return true;
    }

    @Override
    public ValidationOutcome validate(RotationPolicy policy, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return ValidationOutcome.invalid(NAME, "empty value");
        }
        if (!candidate.equals(candidate.strip())) {
            return ValidationOutcome.invalid(NAME, "leading or trailing whitespace");
        }
        return switch (policy.getRotationType()) {
            case PASSWORD, DB_PASSWORD -> validatePassword(candidate);
            case API_KEY -> validateApiKey(policy, candidate);
            case TOKEN -> validateToken(candidate);
            case ENCRYPTION_KEY -> validateEncryptionKey(candidate);
            case CERTIFICATE -> candidate.startsWith("-----BEGIN CERTIFICATE-----")
                    ? ValidationOutcome.valid(NAME)
                    : ValidationOutcome.invalid(NAME, "not a PEM certificate");
        };
    }

    private static ValidationOutcome validatePassword(String candidate) {
        if (candidate.length() < MIN_PASSWORD_LENGTH) {
            return ValidationOutcome.invalid(NAME, "shorter than " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (!UPPER.matcher(candidate).find() || !LOWER.matcher(candidate).find()
                || !DIGIT.matcher(candidate).find() || !SYMBOL.matcher(candidate).find()) {
            return ValidationOutcome.invalid(NAME, "missing a character class");
        }
        return ValidationOutcome.valid(NAME);
    }

    private static ValidationOutcome validateApiKey(RotationPolicy policy, String candidate) {
        ApiKeyTemplate template = ApiKeyTemplate.forKey(policy.getSecretKey());
        return template.matches(candidate)
                ? ValidationOutcome.valid(NAME)
                : ValidationOutcome.invalid(NAME, "does not match the " + template.getProvider() + " key format");
    }

    private static ValidationOutcome validateToken(String candidate) {
        if (candidate.length() < MIN_TOKEN_LENGTH || !BASE64_URL.matcher(candidate).matches()) {
            return ValidationOutcome.invalid(NAME, "not a url-safe token of at least " + MIN_TOKEN_LENGTH + " characters");
        }
        return ValidationOutcome.valid(NAME);
    }

    private static ValidationOutcome validateEncryptionKey(String candidate) {
        try {
            int length = Base64.getDecoder().decode(candidate).length;
            return length == 32 ? ValidationOutcome.valid(NAME) : ValidationOutcome.invalid(NAME, "key is " + length + " bytes, expected 32");
        } catch (IllegalArgumentException e) {
            return ValidationOutcome.invalid(NAME, "not base64");
        }
    }
}
