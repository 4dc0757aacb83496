package com.trustbridge.rotation;

import lombok.experimental.UtilityClass;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

@UtilityClass
public class RandomSecrets {

    public static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    public static final String DIGITS = "0123456789";
    public static final String SYMBOLS = "!@#$%^&*()-_=+[]{}:,.?";
    // no quotes, slashes, '@' or ':' so the value can sit in a connection string
    public static final String DB_SYMBOLS = "!#%^*-_=+";
    public static final String ALPHANUMERIC = UPPER + LOWER + DIGITS;
    public static final String URL_SAFE = ALPHANUMERIC + "-_";
    public static final String HEX = "0123456789abcdef";

    private static final SecureRandom RANDOM = new SecureRandom();

    public static String fromAlphabet(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    /**
     * A random string containing at least one character of every class.
     */
    public static String withEveryClass(int length, String... classes) {
        if (length < classes.length) {
            throw new IllegalArgumentException("length " + length + " cannot hold " + classes.length + " character classes");
        }
        List<Character> chars = new ArrayList<>(length);
        StringBuilder all = new StringBuilder();
        for (String characterClass : classes) {
            chars.add(characterClass.charAt(RANDOM.nextInt(characterClass.length())));
            all.append(characterClass);
        }
        String alphabet = all.toString();
        while (chars.size() < length) {
            chars.add(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        Collections.shuffle(chars, RANDOM);
        StringBuilder sb = new StringBuilder(length);
        chars.forEach(sb::append);
        return sb.toString();
    }

    public static byte[] bytes(int count) {
        byte[] bytes = new byte[count];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static String base64Url(int byteCount) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes(byteCount));
    }
}
