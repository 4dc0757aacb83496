package com.trustbridge.exception;

/**
 * Raised when a value cannot be encrypted or decrypted with the configured key.
 * Components catch it at their boundary and report an absent value instead of propagating it.
 */
public class CryptoException extends RuntimeException {
    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
