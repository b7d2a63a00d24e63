package net.audiobookorganizer.exception;

/**
 * Secret encryption or decryption failed: wrong key, truncated or tampered ciphertext, or an
 * unreadable key file. Decryption never returns partial plaintext alongside this error.
 * RETRYABLE: No
 */
public class SecretCryptoException extends RuntimeException {

    public SecretCryptoException(String message) {
        super(message);
    }

    public SecretCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
