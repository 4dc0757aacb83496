package com.trustbridge.rotation.generators;

import com.trustbridge.models.enums.RotationType;
import com.trustbridge.models.rotation.RotationPolicy;
import com.trustbridge.rotation.RandomSecrets;
import com.trustbridge.spi.SecretGenerator;

/**
 * Passwords with upper case, lower case, digit and symbol characters. Database passwords are longer and avoid
 * symbols that need escaping in connection strings.
 */
public class PasswordSecretGenerator implements SecretGenerator {

    public static final int PASSWORD_LENGTH = 32;
    public static final int DB_PASSWORD_LENGTH = 40;

    private final RotationType type;
    private final int length;
    private final String symbols;

    public PasswordSecretGenerator(RotationType type, int length, String symbols) {
        this.type = type;
        this.length = length;
        this.symbols = symbols;
    }

    public static PasswordSecretGenerator password() {
        return new PasswordSecretGenerator(RotationType.PASSWORD, PASSWORD_LENGTH, RandomSecrets.SYMBOLS);
    }

    public static PasswordSecretGenerator databasePassword() {
        return new PasswordSecretGenerator(RotationType.DB_PASSWORD, DB_PASSWORD_LENGTH, RandomSecrets.DB_SYMBOLS);
    }

    @Override
    public RotationType type() {
        return type;
    }

    @Override
    public String generate(RotationPolicy policy, String currentValue) {
        return RandomSecrets.withEveryClass(length, RandomSecrets.UPPER, RandomSecrets.LOWER, RandomSecrets.DIGITS, symbols);
    }
}
