package com.trustbridge.crypto;

import com.trustbridge.exception.CryptoException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of secret values held in memory and of audit records written to disk.
 * The 12 byte IV is generated per call and prefixed to the ciphertext; the text form is base64.
 */
@Slf4j
public class SecretCipher {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 256;
    private static final int IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecretKey key;
    private final boolean ephemeral;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param base64Key a base64 encoded 16, 24 or 32 byte key, or null/blank to generate an ephemeral key
     * @throws IllegalArgumentException if the key is not valid base64 or has the wrong length
     */
    public SecretCipher(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            log.warn("No encryption key configured, generated an ephemeral key. Encrypted values will not survive a restart");
            this.key = newKey();
            this.ephemeral = true;
        } else {
            byte[] raw = Base64.getDecoder().decode(base64Key.trim());
            if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
                throw new IllegalArgumentException("encryption key must be 16, 24 or 32 bytes, got " + raw.length);
            }
            this.key = new SecretKeySpec(raw, ALGORITHM);
            this.ephemeral = false;
        }
    }

    public boolean isEphemeral() {
        return ephemeral;
    }

    public String encrypt(String plaintext) {
        return Base64.getEncoder().encodeToString(encrypt(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    public String decrypt(String encoded) {
        try {
            return new String(decrypt(Base64.getDecoder().decode(encoded)), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("encrypted value is not valid base64", e);
        }
    }

    public byte[] encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("encryption failed", e);
        }
    }

    public byte[] decrypt(byte[] ivAndCiphertext) {
        if (ivAndCiphertext.length <= IV_LENGTH) {
            throw new CryptoException("encrypted value is too short", null);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, ivAndCiphertext, 0, IV_LENGTH));
            return cipher.doFinal(ivAndCiphertext, IV_LENGTH, ivAndCiphertext.length - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("decryption failed", e);
        }
    }

    /**
     * @return a new random 256 bit key, base64 encoded, suitable for {@code trustbridge.crypto.key}
     */
    public static String generateKey() {
        return Base64.getEncoder().encodeToString(newKey().getEncoded());
    }

    private static SecretKey newKey() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM);
            generator.init(KEY_LENGTH);
            return generator.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES is not available", e);
        }
    }
}
